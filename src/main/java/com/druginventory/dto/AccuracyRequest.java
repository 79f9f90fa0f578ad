package com.druginventory.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class AccuracyRequest {

    @NotNull(message = "predictions is required")
    List<@NotNull Double> predictions;

    @NotNull(message = "actuals is required")
    List<@NotNull Double> actuals;

    @DecimalMin(value = "0.0", message = "previousError must be >= 0")
    @Builder.Default
    double previousError = 0.0;

    @DecimalMin(value = "0.0", message = "retrainThreshold must be >= 0")
    Double retrainThreshold;
}
