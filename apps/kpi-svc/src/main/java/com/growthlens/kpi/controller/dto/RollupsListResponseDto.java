package com.growthlens.kpi.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record RollupsListResponseDto(LocalDate date, String granularity, List<RollupResponseDto> rows, String traceId) {
}
