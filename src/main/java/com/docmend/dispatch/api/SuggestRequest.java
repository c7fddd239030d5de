package com.docmend.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/doc-updates/suggest and POST /api/v1/reviews.
 *
 * @param query natural-language description of the documentation change
 */
public record SuggestRequest(String query) {}
