package com.growthlens.kpi.controller.dto;

public record RunResponseDto(RollupBatchResponseDto rollups, KpiReportResponseDto report) {
}
