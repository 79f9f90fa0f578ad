package com.druginventory.config;

import com.druginventory.dto.ForecastConfigOverrides;
import com.druginventory.model.ForecastConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ForecastConfigResolverTest {

    private static ForecastProperties unset() {
        return new ForecastProperties(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    void resolve_unsetPropertiesAndNoOverrides_yieldsDefaults() {
        ForecastConfigResolver resolver = new ForecastConfigResolver(unset());

        assertThat(resolver.resolve(null)).isEqualTo(ForecastConfig.defaults());
    }

    @Test
    void resolve_propertiesReplaceDefaults() {
        ForecastProperties properties = new ForecastProperties(
            80, null, null, null, null, null, 2.0, 14, null, 10, 0.9, 7L);

        ForecastConfig config = new ForecastConfigResolver(properties).resolve(null);

        assertThat(config.getReservoirSize()).isEqualTo(80);
        assertThat(config.getSafetyStockMultiplier()).isEqualTo(2.0);
        assertThat(config.getForecastHorizon()).isEqualTo(14);
        assertThat(config.getLeadTimeDays()).isEqualTo(10);
        assertThat(config.getServiceLevel()).isEqualTo(0.9);
        assertThat(config.getRandomSeed()).isEqualTo(7L);
        assertThat(config.getSpectralRadius()).isEqualTo(0.95);
    }

    @Test
    void resolve_overridesWinButDoNotLeakIntoLaterCalls() {
        ForecastConfigResolver resolver = new ForecastConfigResolver(unset());

        ForecastConfig overridden = resolver.resolve(ForecastConfigOverrides.builder()
            .forecastHorizon(10)
            .leakingRate(0.5)
            .build());

        assertThat(overridden.getForecastHorizon()).isEqualTo(10);
        assertThat(overridden.getLeakingRate()).isEqualTo(0.5);
        assertThat(overridden.getReservoirSize()).isEqualTo(50);
        assertThat(resolver.resolve(null).getForecastHorizon()).isEqualTo(30);
    }
}
