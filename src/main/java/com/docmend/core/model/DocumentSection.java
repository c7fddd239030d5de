package com.docmend.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A heading-delimited region of a Markdown file.
 *
 * @param title     heading text without the leading hashes
 * @param level     heading depth, 1 to 6
 * @param startLine 1-based line of the heading itself
 * @param endLine   last line before the next heading, or the last line of the file
 * @param content   trimmed body text below the heading
 */
public record DocumentSection(
    String title,
    int level,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    String content
) implements Serializable {}
