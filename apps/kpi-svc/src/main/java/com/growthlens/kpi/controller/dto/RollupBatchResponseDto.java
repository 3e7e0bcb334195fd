package com.growthlens.kpi.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record RollupBatchResponseDto(
        LocalDate date,
        int rowCount,
        Rejections rejections,
        List<SanityIssue> sanityIssues,
        RollupResponseDto global,
        String traceId
) {
    public record Rejections(int accepted, int rejected, List<String> examples) {
    }

    public record SanityIssue(String level, String granularity, String key, String check, String message) {
    }
}
