package com.growthlens.kpi.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.List;

/**
 * Rows for one key on the days strictly before {@code targetDate}, ascending by date. Days
 * without a row are absent, never zero-filled.
 */
public record BaselineWindow(
        Granularity granularity,
        String granularityKey,
        LocalDate targetDate,
        int windowDays,
        List<RollupRow> rows
) {

    public BaselineWindow {
        rows = List.copyOf(rows);
    }

    public List<BigDecimal> definedValues(Metric metric) {
        return rows.stream()
                .map(metric::exactValueOf)
                .flatMap(Optional::stream)
                .toList();
    }

    public int validDays(Metric metric) {
        return definedValues(metric).size();
    }

    public List<LocalDate> dates() {
        return rows.stream().map(RollupRow::date).toList();
    }
}
