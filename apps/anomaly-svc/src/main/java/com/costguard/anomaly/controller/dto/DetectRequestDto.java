package com.costguard.anomaly.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record DetectRequestDto(
        @NotEmpty List<@Valid Observation> observations,
        @Positive Double threshold
) {
    public record Observation(
            @NotNull LocalDate date,
            @NotNull Double total,
            Map<String, Double> contributors
    ) {
    }
}
