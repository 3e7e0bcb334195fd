package com.growthlens.kpi.model;

import java.util.List;

/**
 * Record-level rejections of one batch: how many and the first few reasons.
 */
public record RejectionSummary(int accepted, int rejected, List<String> examples) {

    public RejectionSummary {
        examples = List.copyOf(examples);
    }

    public static RejectionSummary none() {
        return new RejectionSummary(0, 0, List.of());
    }
}
