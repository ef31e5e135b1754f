package com.brandsentinel.core.storage;

/**
 * Raised when a storage backend cannot save or query records.
 *
 * <p>
 * Storage failures are never fatal to the pipeline: callers log them and
 * carry on.
 * </p>
 *
 * @since 1.0.0
 */
public class StorageException extends Exception {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
