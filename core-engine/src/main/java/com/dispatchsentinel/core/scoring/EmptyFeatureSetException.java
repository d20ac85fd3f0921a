package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.model.ScoringMethod;

/**
 * Thrown when a scorer has no usable numeric input. Callers skip the scorer
 * for the affected fold rather than failing the run.
 *
 * @since 1.0.0
 */
public class EmptyFeatureSetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ScoringMethod method;

    public EmptyFeatureSetException(ScoringMethod method, String message) {
        super(message);
        this.method = method;
    }

    public ScoringMethod getMethod() {
        return method;
    }
}
