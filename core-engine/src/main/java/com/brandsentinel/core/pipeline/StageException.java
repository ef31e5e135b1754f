package com.brandsentinel.core.pipeline;

/**
 * Failure of a single stage on a single event or result.
 *
 * <p>
 * The engine logs it and moves on; it never aborts the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public class StageException extends Exception {

    private static final long serialVersionUID = 1L;

    public StageException(String message) {
        super(message);
    }

    public StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
