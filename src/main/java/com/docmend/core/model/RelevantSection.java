package com.docmend.core.model;

/**
 * A section matched against a query, with the number of query keywords it contains.
 */
public record RelevantSection(
    String filePath,
    DocumentSection section,
    int score
) {}
