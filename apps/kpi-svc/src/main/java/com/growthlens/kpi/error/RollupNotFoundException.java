package com.growthlens.kpi.error;

import java.time.LocalDate;

public class RollupNotFoundException extends KpiException {

    private final LocalDate date;

    public RollupNotFoundException(LocalDate date) {
        super("No global rollup stored for " + date);
        this.date = date;
    }

    public LocalDate date() {
        return date;
    }
}
