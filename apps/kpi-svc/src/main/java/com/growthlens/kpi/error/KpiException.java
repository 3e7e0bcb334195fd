package com.growthlens.kpi.error;

public class KpiException extends RuntimeException {

    public KpiException(String message) {
        super(message);
    }

    public KpiException(String message, Throwable cause) {
        super(message, cause);
    }
}
