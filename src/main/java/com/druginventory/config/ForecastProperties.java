package com.druginventory.config;

import com.druginventory.model.ForecastConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deployment-wide forecast defaults bound from {@code inventory.forecast.*}. Unset keys fall back
 * to the {@link ForecastConfig} defaults.
 */
@ConfigurationProperties(prefix = "inventory.forecast")
public record ForecastProperties(
        Integer reservoirSize,
        Double spectralRadius,
        Double reservoirDensity,
        Double inputScaling,
        Double leakingRate,
        Double ridgeRegularization,
        Double safetyStockMultiplier,
        Integer forecastHorizon,
        Double retrainThreshold,
        Integer leadTimeDays,
        Double serviceLevel,
        Long randomSeed
) {

    public ForecastConfig toForecastConfig() {
        ForecastConfig defaults = ForecastConfig.defaults();
        return ForecastConfig.builder()
            .reservoirSize(reservoirSize != null ? reservoirSize : defaults.getReservoirSize())
            .spectralRadius(spectralRadius != null ? spectralRadius : defaults.getSpectralRadius())
            .reservoirDensity(reservoirDensity != null ? reservoirDensity : defaults.getReservoirDensity())
            .inputScaling(inputScaling != null ? inputScaling : defaults.getInputScaling())
            .leakingRate(leakingRate != null ? leakingRate : defaults.getLeakingRate())
            .ridgeRegularization(ridgeRegularization != null ? ridgeRegularization : defaults.getRidgeRegularization())
            .safetyStockMultiplier(safetyStockMultiplier != null ? safetyStockMultiplier : defaults.getSafetyStockMultiplier())
            .forecastHorizon(forecastHorizon != null ? forecastHorizon : defaults.getForecastHorizon())
            .retrainThreshold(retrainThreshold != null ? retrainThreshold : defaults.getRetrainThreshold())
            .leadTimeDays(leadTimeDays != null ? leadTimeDays : defaults.getLeadTimeDays())
            .serviceLevel(serviceLevel != null ? serviceLevel : defaults.getServiceLevel())
            .randomSeed(randomSeed != null ? randomSeed : defaults.getRandomSeed())
            .build();
    }
}
