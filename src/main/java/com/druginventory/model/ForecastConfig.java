package com.druginventory.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable tuning for one forecast call. Use {@link #toBuilder()} to derive a variant.
 */
@Value
@Builder(toBuilder = true)
public class ForecastConfig {
    @Builder.Default
    int reservoirSize = 50;
    @Builder.Default
    double spectralRadius = 0.95;
    @Builder.Default
    double reservoirDensity = 0.1;
    @Builder.Default
    double inputScaling = 0.3;
    @Builder.Default
    double leakingRate = 0.3;
    @Builder.Default
    double ridgeRegularization = 0.01;
    @Builder.Default
    double safetyStockMultiplier = 1.5;
    @Builder.Default
    int forecastHorizon = 30;
    @Builder.Default
    double retrainThreshold = 0.5;
    @Builder.Default
    int leadTimeDays = 7;
    @Builder.Default
    double serviceLevel = 0.95;
    @Builder.Default
    long randomSeed = 42L;

    public static ForecastConfig defaults() {
        return ForecastConfig.builder().build();
    }
}
