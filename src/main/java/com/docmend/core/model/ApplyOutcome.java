package com.docmend.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-suggestion result of one apply call.
 */
public record ApplyOutcome(
    List<Applied> successes,
    List<Failed> errors,
    List<String> backups
) {

    public ApplyOutcome {
        successes = List.copyOf(successes);
        errors = List.copyOf(errors);
        backups = List.copyOf(backups);
    }

    @JsonProperty("message")
    public String message() {
        String message = "Applied " + successes.size() + " updates successfully";
        return errors.isEmpty() ? message : message + ", " + errors.size() + " failed";
    }

    public record Applied(
        @JsonProperty("suggestion_id") int suggestionId,
        @JsonProperty("file_path") String filePath,
        String message
    ) {}

    public record Failed(
        @JsonProperty("suggestion_id") int suggestionId,
        String error
    ) {}
}
