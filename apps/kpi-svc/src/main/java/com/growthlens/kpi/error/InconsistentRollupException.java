package com.growthlens.kpi.error;

import java.time.LocalDate;

/**
 * Keyed rollups for a date do not add up to the global rollup. Processing of the date must stop.
 */
public class InconsistentRollupException extends KpiException {

    private final LocalDate date;

    public InconsistentRollupException(LocalDate date, String message) {
        super("Inconsistent rollup for " + date + ": " + message);
        this.date = date;
    }

    public InconsistentRollupException(LocalDate date, String message, Throwable cause) {
        super("Inconsistent rollup for " + date + ": " + message, cause);
        this.date = date;
    }

    public LocalDate date() {
        return date;
    }
}
