package com.lifter.resolution.store;

/**
 * Runtime exception thrown when a repository write or read fails.
 * Aborts the current row only.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
