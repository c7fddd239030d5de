package com.docmend.core.model;

/**
 * A suggestion as produced by a strategy, before the generator numbers it.
 */
public record SuggestionDraft(
    String section,
    String suggestionText,
    String filePath,
    Integer lineNumber
) {

    public Suggestion toSuggestion(int id) {
        return new Suggestion(id, section, suggestionText, filePath, lineNumber);
    }
}
