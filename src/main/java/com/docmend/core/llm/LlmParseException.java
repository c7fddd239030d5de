package com.docmend.core.llm;

/**
 * Thrown when LLM output cannot be parsed into suggestions.
 */
public class LlmParseException extends RuntimeException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
