package com.docmend.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the domain records and their JSON shape.
 */
class ModelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    // ═══════════════════════════════════════════════════════════════════
    //  Suggestions
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Suggestion")
    class SuggestionTests {

        @Test
        @DisplayName("serializes with snake_case names and omits null anchors")
        void serializes() throws Exception {
            String json = mapper.writeValueAsString(new Suggestion(1, "General", "Add a note.", null, null));
            assertEquals("{\"id\":1,\"section\":\"General\",\"suggestion_text\":\"Add a note.\"}", json);
        }

        @Test
        @DisplayName("accepts the legacy 'suggestion' key and camelCase aliases")
        void readsAliases() throws Exception {
            Suggestion legacy = mapper.readValue(
                    "{\"id\":2,\"section\":\"S\",\"suggestion\":\"t\",\"file_path\":\"a.md\",\"line_number\":3}",
                    Suggestion.class);
            Suggestion camel = mapper.readValue(
                    "{\"id\":2,\"section\":\"S\",\"suggestionText\":\"t\",\"filePath\":\"a.md\",\"lineNumber\":3}",
                    Suggestion.class);
            assertEquals(new Suggestion(2, "S", "t", "a.md", 3), legacy);
            assertEquals(legacy, camel);
        }

        @Test
        @DisplayName("withText keeps id and anchor")
        void withText() {
            Suggestion s = new Suggestion(4, "S", "old", "a.md", 9).withText("new");
            assertEquals(new Suggestion(4, "S", "new", "a.md", 9), s);
        }

        @Test
        @DisplayName("drafts receive their id on numbering")
        void draftToSuggestion() {
            assertEquals(new Suggestion(3, "S", "t", null, null),
                    new SuggestionDraft("S", "t", null, null).toSuggestion(3));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Review state
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Review state")
    class ReviewStateTests {

        @Test
        @DisplayName("ReviewStatus has all expected values")
        void statusValues() {
            ReviewStatus[] expected = {
                ReviewStatus.PENDING, ReviewStatus.APPROVED, ReviewStatus.REJECTED, ReviewStatus.EDITED
            };
            assertArrayEquals(expected, ReviewStatus.values());
        }

        @Test
        @DisplayName("only approved and edited states are selected for apply")
        void selection() {
            assertFalse(ReviewState.PENDING.isSelected());
            assertFalse(new ReviewState(ReviewStatus.REJECTED, null).isSelected());
            assertTrue(new ReviewState(ReviewStatus.APPROVED, null).isSelected());
            assertTrue(new ReviewState(ReviewStatus.EDITED, "x").isSelected());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Apply outcome
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("ApplyOutcome")
    class ApplyOutcomeTests {

        @Test
        @DisplayName("message counts successes and mentions failures only when present")
        void message() {
            var ok = new ApplyOutcome(List.of(new ApplyOutcome.Applied(1, "a.md", "Successfully applied")),
                    List.of(), List.of());
            assertEquals("Applied 1 updates successfully", ok.message());

            var mixed = new ApplyOutcome(List.of(), List.of(new ApplyOutcome.Failed(2, "file not found")), List.of());
            assertEquals("Applied 0 updates successfully, 1 failed", mixed.message());
        }

        @Test
        @DisplayName("lists are copied, so later changes to the inputs do not leak in")
        void copiesLists() {
            var backups = new ArrayList<String>(List.of("b1"));
            var outcome = new ApplyOutcome(List.of(), List.of(), backups);
            backups.add("b2");

            assertEquals(List.of("b1"), outcome.backups());
            assertThrows(UnsupportedOperationException.class, () -> outcome.backups().add("b3"));
        }

        @Test
        @DisplayName("serializes per-item ids in snake_case")
        void serializes() throws Exception {
            var outcome = new ApplyOutcome(List.of(new ApplyOutcome.Applied(1, "a.md", "Successfully applied")),
                    List.of(new ApplyOutcome.Failed(2, "file not found")), List.of("/b/a.md"));
            var tree = mapper.readTree(mapper.writeValueAsString(outcome));

            assertEquals(1, tree.get("successes").get(0).get("suggestion_id").asInt());
            assertEquals("a.md", tree.get("successes").get(0).get("file_path").asText());
            assertEquals("file not found", tree.get("errors").get(0).get("error").asText());
            assertEquals("Applied 1 updates successfully, 1 failed", tree.get("message").asText());
        }
    }
}
