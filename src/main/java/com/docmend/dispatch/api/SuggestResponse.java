package com.docmend.dispatch.api;

import com.docmend.core.model.Suggestion;

import java.util.List;

public record SuggestResponse(
    List<Suggestion> suggestions,
    String message
) {}
