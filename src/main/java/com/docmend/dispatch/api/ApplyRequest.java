package com.docmend.dispatch.api;

import com.docmend.core.model.Suggestion;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/doc-updates/apply. Contains only approved or
 * edited suggestions, with the effective text already in {@code suggestion_text}.
 */
public record ApplyRequest(List<Suggestion> suggestions) {}
