package com.pumpd.backend.exceptions;

/**
 * Thrown when a request or a sequence template fails validation.
 * Raised before any sequence state is written.
 */
public class SequenceValidationException extends RuntimeException {

    public SequenceValidationException(String message) {
        super(message);
    }
}
