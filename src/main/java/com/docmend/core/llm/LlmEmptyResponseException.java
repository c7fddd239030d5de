package com.docmend.core.llm;

/**
 * Thrown when the LLM returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends LlmUnavailableException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
