package com.growthlens.kpi.repository;

import com.growthlens.kpi.model.Granularity;
import com.growthlens.kpi.model.RollupRow;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate table access. Writes always replace whole rows.
 */
public interface RollupStore {

    Optional<RollupRow> getRollup(LocalDate date, Granularity granularity, String granularityKey);

    RollupRow putRollup(RollupRow row);

    List<RollupRow> findRollups(LocalDate date, Granularity granularity);

    /**
     * Replaces every stored row of {@code date} with {@code rows} as a single unit.
     */
    void replaceRollups(LocalDate date, List<RollupRow> rows);
}
