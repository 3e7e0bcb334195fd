package com.growthlens.kpi.error;

/**
 * A fact row that breaks a field-level invariant. Rejects that record only.
 */
public class FactValidationException extends KpiException {

    private final String field;
    private final String invariant;

    public FactValidationException(String field, String invariant) {
        super(field + " violates " + invariant);
        this.field = field;
        this.invariant = invariant;
    }

    public String field() {
        return field;
    }

    public String invariant() {
        return invariant;
    }
}
