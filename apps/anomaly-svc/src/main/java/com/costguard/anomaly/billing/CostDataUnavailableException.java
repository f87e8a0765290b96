package com.costguard.anomaly.billing;

public class CostDataUnavailableException extends RuntimeException {

    public CostDataUnavailableException(String message) {
        super(message);
    }

    public CostDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
