package com.growthlens.kpi.model;

import java.util.List;

public record DetectionResult(List<AnomalyFinding> findings, List<RuleSkip> skipped) {

    public DetectionResult {
        findings = List.copyOf(findings);
        skipped = List.copyOf(skipped);
    }
}
