package com.docmend.core.suggest;

/**
 * Thrown for caller-fixable input problems such as a blank query.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
