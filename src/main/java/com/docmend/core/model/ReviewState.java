package com.docmend.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Review state of one suggestion. {@code editedText} is non-null only while
 * the status is {@link ReviewStatus#EDITED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewState(
    ReviewStatus status,
    @JsonProperty("edited_text") String editedText
) {

    public static final ReviewState PENDING = new ReviewState(ReviewStatus.PENDING, null);

    public boolean isSelected() {
        return status == ReviewStatus.APPROVED || status == ReviewStatus.EDITED;
    }
}
