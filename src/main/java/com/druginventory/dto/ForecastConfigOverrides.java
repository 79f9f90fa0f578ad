package com.druginventory.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Optional per-request tuning. Null fields keep the configured default.
 */
@Value
@Builder
@Jacksonized
public class ForecastConfigOverrides {

    @Min(value = 1, message = "reservoirSize must be >= 1")
    @Max(value = 500, message = "reservoirSize must be <= 500")
    Integer reservoirSize;

    @DecimalMin(value = "0.0", inclusive = false, message = "spectralRadius must be > 0")
    Double spectralRadius;

    @DecimalMin(value = "0.0", message = "inputScaling must be >= 0")
    Double inputScaling;

    @DecimalMin(value = "0.0", inclusive = false, message = "leakingRate must be in (0, 1]")
    @DecimalMax(value = "1.0", message = "leakingRate must be in (0, 1]")
    Double leakingRate;

    @DecimalMin(value = "0.0", message = "safetyStockMultiplier must be >= 0")
    Double safetyStockMultiplier;

    @Min(value = 1, message = "forecastHorizon must be >= 1")
    @Max(value = 365, message = "forecastHorizon must be <= 365")
    Integer forecastHorizon;

    @DecimalMin(value = "0.0", message = "retrainThreshold must be >= 0")
    Double retrainThreshold;

    @Min(value = 1, message = "leadTimeDays must be >= 1")
    Integer leadTimeDays;

    @DecimalMin(value = "0.50", message = "serviceLevel must be between 0.50 and 0.999")
    @DecimalMax(value = "0.999", message = "serviceLevel must be between 0.50 and 0.999")
    Double serviceLevel;

    Long randomSeed;
}
