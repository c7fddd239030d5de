package com.docmend.dispatch.api;

import com.docmend.core.model.ReviewState;
import com.docmend.core.model.ReviewStatus;
import com.docmend.core.review.ReviewSession;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON view of a review session.
 */
public record ReviewResponse(
    @JsonProperty("review_id") String reviewId,
    List<ReviewItem> suggestions
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ReviewItem(
        int id,
        String section,
        @JsonProperty("suggestion_text") String suggestionText,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("line_number") Integer lineNumber,
        ReviewStatus status,
        @JsonProperty("edited_text") String editedText,
        @JsonProperty("effective_text") String effectiveText
    ) {}

    public static ReviewResponse of(String reviewId, ReviewSession session) {
        List<ReviewItem> items = session.suggestions().stream()
                .map(s -> {
                    ReviewState state = session.state(s.id());
                    return new ReviewItem(s.id(), s.section(), s.suggestionText(), s.filePath(), s.lineNumber(),
                            state.status(), state.editedText(), session.effectiveText(s.id()));
                })
                .toList();
        return new ReviewResponse(reviewId, items);
    }
}
