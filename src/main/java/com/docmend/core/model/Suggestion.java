package com.docmend.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single addressable edit proposed for the documentation corpus.
 *
 * @param id             sequential id within one generation response, starting at 1
 * @param section        human-readable label, usually the nearest heading
 * @param suggestionText proposed replacement or insertion text
 * @param filePath       corpus-relative target file; nullable when no file could be determined
 * @param lineNumber     1-based anchor line; nullable means append without a precise anchor
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Suggestion(
    int id,
    String section,
    @JsonProperty("suggestion_text") @JsonAlias({"suggestion", "suggestionText"}) String suggestionText,
    @JsonProperty("file_path") @JsonAlias("filePath") String filePath,
    @JsonProperty("line_number") @JsonAlias("lineNumber") Integer lineNumber
) implements Serializable {

    public Suggestion withText(String text) {
        return new Suggestion(id, section, text, filePath, lineNumber);
    }
}
