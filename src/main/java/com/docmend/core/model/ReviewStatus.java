package com.docmend.core.model;

/**
 * Review decision recorded against a suggestion.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EDITED
}
