package com.docmend.core.corpus;

import com.docmend.core.model.DocumentFile;
import com.docmend.core.model.RelevantSection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CorpusIndex}.
 * <p>
 * Uses JUnit 5's {@code @TempDir} so every test sees an isolated corpus.
 */
class CorpusIndexTest {

    @TempDir
    Path tempDir;

    CorpusIndex index;

    @BeforeEach
    void setUp() {
        index = indexFor(tempDir);
    }

    private static CorpusIndex indexFor(Path root) {
        var props = new CorpusProperties();
        props.setRoot(root.toString());
        return new CorpusIndex(props);
    }

    // ── Listing ──────────────────────────────────────────────────────

    @Test
    @DisplayName("empty corpus lists no files")
    void emptyCorpus() {
        assertTrue(index.listFiles().isEmpty());
    }

    @Test
    @DisplayName("lists Markdown files at every depth, sorted by relative path")
    void listsMarkdownSorted() throws IOException {
        Files.createDirectories(tempDir.resolve("guides/advanced"));
        Files.writeString(tempDir.resolve("zeta.md"), "# Z\n");
        Files.writeString(tempDir.resolve("guides/intro.md"), "# Intro\n");
        Files.writeString(tempDir.resolve("guides/advanced/agents.md"), "# Agents\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not docs");

        List<String> paths = index.listFiles().stream().map(DocumentFile::path).toList();

        assertEquals(List.of("guides/advanced/agents.md", "guides/intro.md", "zeta.md"), paths);
    }

    @Test
    @DisplayName("ignores .git and node_modules directories")
    void ignoresToolDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve(".git"));
        Files.createDirectories(tempDir.resolve("node_modules/pkg"));
        Files.writeString(tempDir.resolve(".git/README.md"), "# git");
        Files.writeString(tempDir.resolve("node_modules/pkg/README.md"), "# pkg");
        Files.writeString(tempDir.resolve("README.md"), "# Hello");

        List<String> paths = index.listFiles().stream().map(DocumentFile::path).toList();

        assertEquals(List.of("README.md"), paths);
    }

    @Test
    @DisplayName("reads content, line count and sections")
    void readsDocumentDetails() throws IOException {
        Files.writeString(tempDir.resolve("guide.md"), """
                # Guide
                Intro text.
                ## Install
                Run the installer.
                """);

        DocumentFile file = index.load("guide.md").orElseThrow();

        assertEquals("guide.md", file.name());
        assertEquals(4, file.lineCount());
        assertEquals(2, file.sections().size());
        assertEquals("Install", file.sections().get(1).title());
        assertEquals(3, file.sections().get(1).startLine());
        assertEquals(4, file.sections().get(1).endLine());
        assertEquals("Run the installer.", file.sections().get(1).content());
    }

    // ── Resolution ───────────────────────────────────────────────────

    @Test
    @DisplayName("resolve accepts existing files inside the root")
    void resolvesExistingFile() throws IOException {
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("sub/a.md"), "a");

        assertTrue(index.resolve("sub/a.md").isPresent());
        assertTrue(index.resolve("sub/../sub/a.md").isPresent());
    }

    @Test
    @DisplayName("resolve rejects missing, escaping and absolute paths")
    void rejectsBadPaths() throws IOException {
        Path outside = Files.createTempFile("outside", ".md");
        try {
            assertTrue(index.resolve("missing.md").isEmpty());
            assertTrue(index.resolve("../" + outside.getFileName()).isEmpty());
            assertTrue(index.resolve(outside.toString()).isEmpty());
            assertTrue(index.resolve("").isEmpty());
            assertTrue(index.resolve(null).isEmpty());
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    @DisplayName("resolve rejects directories")
    void rejectsDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve("dir.md"));
        assertTrue(index.resolve("dir.md").isEmpty());
    }

    // ── Relevance ────────────────────────────────────────────────────

    @Test
    @DisplayName("findRelevantSections ranks by keyword hits")
    void ranksRelevantSections() throws IOException {
        Files.writeString(tempDir.resolve("a.md"), """
                # Agents
                Agents call tools.
                # Tools
                Handoff between agents uses tools.
                """);
        Files.writeString(tempDir.resolve("b.md"), """
                # Unrelated
                Nothing here.
                """);

        List<RelevantSection> relevant = index.findRelevantSections("agents handoff", 10);

        assertEquals(2, relevant.size());
        assertEquals("Tools", relevant.get(0).section().title());
        assertEquals(2, relevant.get(0).score());
        assertEquals("Agents", relevant.get(1).section().title());
    }

    @Test
    @DisplayName("findRelevantSections honours the limit")
    void relevantSectionsLimit() throws IOException {
        Files.writeString(tempDir.resolve("a.md"), "# One agents\n# Two agents\n# Three agents\n");
        assertEquals(2, index.findRelevantSections("agents", 2).size());
    }

    @Test
    @DisplayName("outline lists paths and headings within the size bound")
    void outline() throws IOException {
        Files.writeString(tempDir.resolve("a.md"), "# Top\n## Child\n");
        Files.writeString(tempDir.resolve("b.md"), "# Other\n");

        String outline = index.outline(10_000);
        assertTrue(outline.contains("a.md"));
        assertTrue(outline.contains("- Top (line 1)"));
        assertTrue(outline.contains("  - Child (line 2)"));
        assertTrue(outline.contains("b.md"));

        String truncated = index.outline(20);
        assertFalse(truncated.contains("b.md"));
    }

    // ── Startup ──────────────────────────────────────────────────────

    @Test
    @DisplayName("missing corpus root fails fast")
    void missingRootFails() {
        assertThrows(IllegalStateException.class, () -> indexFor(tempDir.resolve("nope")));
    }
}
