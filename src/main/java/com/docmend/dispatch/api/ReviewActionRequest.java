package com.docmend.dispatch.api;

/**
 * Request body for a review decision.
 *
 * @param action one of {@code approve}, {@code reject}, {@code edit}
 * @param text   replacement text; only used with {@code edit}, nullable
 */
public record ReviewActionRequest(
    String action,
    String text
) {}
