package com.z254.argus.search;

/**
 * Raised when an index snapshot cannot be written or read back.
 */
public class IndexPersistenceException extends RuntimeException {

    public IndexPersistenceException(String message) {
        super(message);
    }

    public IndexPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
