package com.dispatchsentinel.core.pipeline;

/**
 * Unrecoverable pipeline failure. The run produces no artifacts.
 *
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
