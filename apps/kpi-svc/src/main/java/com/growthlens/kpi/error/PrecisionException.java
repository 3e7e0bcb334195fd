package com.growthlens.kpi.error;

/**
 * A monetary amount that cannot be expressed in minor units under half-up rounding.
 * Rejects the record it belongs to.
 */
public class PrecisionException extends KpiException {

    private final String field;

    public PrecisionException(String message) {
        this(null, message);
    }

    public PrecisionException(String field, String message) {
        super(field == null ? message : field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    public PrecisionException forField(String fieldName) {
        PrecisionException scoped = new PrecisionException(fieldName, getMessage());
        scoped.initCause(this);
        return scoped;
    }
}
