package com.costguard.anomaly.analytics;

/**
 * The observation window cannot produce a trustworthy baseline (empty, duplicated days, negative or non-finite
 * costs). Aborts the whole detection run.
 */
public class InvalidCostWindowException extends IllegalArgumentException {

    public InvalidCostWindowException(String message) {
        super(message);
    }
}
