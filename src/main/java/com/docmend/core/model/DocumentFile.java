package com.docmend.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A documentation file read from the corpus root.
 *
 * @param path      corpus-relative path using {@code /} separators
 * @param name      file base name
 * @param content   full raw text
 * @param lineCount number of lines in {@code content}
 * @param sections  heading-delimited sections, in file order
 */
public record DocumentFile(
    String path,
    String name,
    @JsonIgnore String content,
    @JsonProperty("line_count") int lineCount,
    List<DocumentSection> sections
) implements Serializable {

    @JsonProperty("size")
    public int size() {
        return content.length();
    }
}
