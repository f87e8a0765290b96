package com.costguard.anomaly.analytics;

/**
 * A statistical invariant was violated after the baseline step, e.g. a zero MAD reached scoring.
 * Indicates a defect rather than bad input.
 */
public class BaselineComputationException extends IllegalStateException {

    public BaselineComputationException(String message) {
        super(message);
    }
}
