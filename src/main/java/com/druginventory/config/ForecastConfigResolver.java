package com.druginventory.config;

import com.druginventory.dto.ForecastConfigOverrides;
import com.druginventory.model.ForecastConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Layers per-request overrides over the configured defaults, producing a new immutable config each call.
 */
@Component
@RequiredArgsConstructor
public class ForecastConfigResolver {

    private final ForecastProperties properties;

    public ForecastConfig resolve(ForecastConfigOverrides overrides) {
        ForecastConfig base = properties.toForecastConfig();
        if (overrides == null) {
            return base;
        }
        ForecastConfig.ForecastConfigBuilder builder = base.toBuilder();
        if (overrides.getReservoirSize() != null) {
            builder.reservoirSize(overrides.getReservoirSize());
        }
        if (overrides.getSpectralRadius() != null) {
            builder.spectralRadius(overrides.getSpectralRadius());
        }
        if (overrides.getInputScaling() != null) {
            builder.inputScaling(overrides.getInputScaling());
        }
        if (overrides.getLeakingRate() != null) {
            builder.leakingRate(overrides.getLeakingRate());
        }
        if (overrides.getSafetyStockMultiplier() != null) {
            builder.safetyStockMultiplier(overrides.getSafetyStockMultiplier());
        }
        if (overrides.getForecastHorizon() != null) {
            builder.forecastHorizon(overrides.getForecastHorizon());
        }
        if (overrides.getRetrainThreshold() != null) {
            builder.retrainThreshold(overrides.getRetrainThreshold());
        }
        if (overrides.getLeadTimeDays() != null) {
            builder.leadTimeDays(overrides.getLeadTimeDays());
        }
        if (overrides.getServiceLevel() != null) {
            builder.serviceLevel(overrides.getServiceLevel());
        }
        if (overrides.getRandomSeed() != null) {
            builder.randomSeed(overrides.getRandomSeed());
        }
        return builder.build();
    }
}
