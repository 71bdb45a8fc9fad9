package com.docsage.api.exception;

/**
 * The shared store rejected or could not complete a read or write.
 * Nothing from the failed operation is visible to other callers.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
