package com.growthlens.kpi.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * All rollup rows computed for one date, plus what the batch rejected or flagged.
 */
public record RollupBatch(
        LocalDate date,
        List<RollupRow> rows,
        RejectionSummary rejections,
        List<SanityIssue> sanityIssues
) {

    public RollupBatch {
        rows = List.copyOf(rows);
        sanityIssues = List.copyOf(sanityIssues);
    }

    public Optional<RollupRow> global() {
        return rows.stream().filter(RollupRow::isGlobal).findFirst();
    }
}
