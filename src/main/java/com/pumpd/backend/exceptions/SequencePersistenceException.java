package com.pumpd.backend.exceptions;

/**
 * Thrown when the instance and task rows for a sequence could not be written.
 * The surrounding transaction is rolled back, so no partial instance survives.
 */
public class SequencePersistenceException extends RuntimeException {

    public SequencePersistenceException(String message) {
        super(message);
    }

    public SequencePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
