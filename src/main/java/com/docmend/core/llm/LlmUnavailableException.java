package com.docmend.core.llm;

/**
 * Thrown when the generative-text provider cannot serve a request: not configured,
 * timed out, rate-limited, or unreachable.
 */
public class LlmUnavailableException extends RuntimeException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
