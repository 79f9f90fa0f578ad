package com.druginventory.service;

import com.druginventory.exception.InventoryInputException;
import com.druginventory.model.AccuracyReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForecastAccuracyServiceTest {

    private final ForecastAccuracyService service = new ForecastAccuracyService();

    @Test
    void rmse_rootMeanSquaredError() {
        assertThat(service.rmse(List.of(1.0, 2.0, 3.0), List.of(1.0, 2.0, 5.0)))
            .isCloseTo(Math.sqrt(4.0 / 3.0), within(1e-12));
    }

    @Test
    void rmse_emptyOrMismatched_isZero() {
        assertThat(service.rmse(List.of(), List.of())).isZero();
        assertThat(service.rmse(List.of(1.0), List.of(1.0, 2.0))).isZero();
    }

    @Test
    void shouldRetrain_onlyWhenErrorGrowsBeyondThreshold() {
        List<Double> predictions = List.of(3.0);
        List<Double> actuals = List.of(1.0);

        assertThat(service.shouldRetrain(predictions, actuals, 1.0, 0.5)).isTrue();
        assertThat(service.shouldRetrain(predictions, actuals, 1.8, 0.5)).isFalse();
    }

    @Test
    void evaluate_computesErrorMetrics() {
        AccuracyReport report = service.evaluate(List.of(110.0, 90.0), List.of(100.0, 100.0), 4.0, 0.5);

        assertThat(report.getSampleCount()).isEqualTo(2);
        assertThat(report.getMae()).isEqualTo(10.0);
        assertThat(report.getRmse()).isEqualTo(10.0);
        assertThat(report.getMape()).isEqualTo(10.0);
        assertThat(report.getErrorIncrease()).isEqualTo(6.0);
        assertThat(report.isRetrainRecommended()).isTrue();
    }

    @Test
    void evaluate_zeroActualsExcludedFromMape() {
        AccuracyReport report = service.evaluate(List.of(2.0, 5.0), List.of(0.0, 4.0), 0.0, 10.0);

        assertThat(report.getMape()).isEqualTo(25.0);
        assertThat(report.isRetrainRecommended()).isFalse();
    }

    @Test
    void evaluate_emptySeries_reportsNoSamples() {
        AccuracyReport report = service.evaluate(List.of(), List.of(), 0.0, 0.5);

        assertThat(report.getSampleCount()).isZero();
        assertThat(report.getRmse()).isNull();
    }

    @Test
    void evaluate_lengthMismatch_rejected() {
        assertThatThrownBy(() -> service.evaluate(List.of(1.0), List.of(), 0.0, 0.5))
            .isInstanceOf(InventoryInputException.class);
    }
}
