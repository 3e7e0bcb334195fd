package com.growthlens.kpi.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public record BackfillRequestDto(@NotNull LocalDate from, @NotNull LocalDate to) {
}
