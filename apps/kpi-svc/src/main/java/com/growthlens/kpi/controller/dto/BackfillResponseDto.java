package com.growthlens.kpi.controller.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record BackfillResponseDto(List<LocalDate> completed, Map<LocalDate, String> failed, String traceId) {
}
