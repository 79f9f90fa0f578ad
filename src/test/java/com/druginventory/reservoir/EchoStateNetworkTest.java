package com.druginventory.reservoir;

import com.druginventory.model.ForecastConfig;
import com.druginventory.model.ReservoirModel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EchoStateNetworkTest {

    @Test
    void initialize_sameSeed_buildsIdenticalReservoir() {
        ForecastConfig config = ForecastConfig.defaults();

        ReservoirModel first = EchoStateNetwork.initialize(config, 2);
        ReservoirModel second = EchoStateNetwork.initialize(config, 2);

        assertThat(Arrays.deepEquals(first.getWeights(), second.getWeights())).isTrue();
        assertThat(Arrays.deepEquals(first.getInputWeights(), second.getInputWeights())).isTrue();
    }

    @Test
    void initialize_differentSeed_buildsDifferentReservoir() {
        ReservoirModel first = EchoStateNetwork.initialize(ForecastConfig.defaults(), 2);
        ReservoirModel second = EchoStateNetwork.initialize(
            ForecastConfig.defaults().toBuilder().randomSeed(7L).build(), 2);

        assertThat(Arrays.deepEquals(first.getWeights(), second.getWeights())).isFalse();
    }

    @Test
    void initialize_scalesLargestRowSumToSpectralRadius() {
        ForecastConfig config = ForecastConfig.defaults();
        ReservoirModel model = EchoStateNetwork.initialize(config, 2);

        double maxRowSum = Arrays.stream(model.getWeights())
            .mapToDouble(row -> Arrays.stream(row).map(Math::abs).sum())
            .max()
            .orElse(0.0);

        assertThat(model.size()).isEqualTo(50);
        assertThat(model.getInputWeights()[0]).hasSize(2);
        assertThat(maxRowSum).isCloseTo(config.getSpectralRadius(), within(1e-9));
    }

    @Test
    void updateState_blendsPreviousStateWithActivation() {
        double[] next = EchoStateNetwork.updateState(
            new double[]{0.0},
            new double[]{1.0, 0.0},
            new double[][]{{0.0}},
            new double[][]{{1.0, 0.0}},
            0.5,
            0.3);

        assertThat(next[0]).isCloseTo(0.3 * Math.tanh(0.5), within(1e-12));
    }

    @Test
    void updateState_zeroInputAndState_staysAtRest() {
        ReservoirModel model = EchoStateNetwork.initialize(ForecastConfig.defaults(), 2);

        double[] next = EchoStateNetwork.updateState(new double[50], new double[]{0.0, 0.0},
            model.getWeights(), model.getInputWeights(), 0.1, 0.3);

        assertThat(next).containsOnly(0.0);
    }

    @Test
    void trainReadout_fitsEachDimensionIndependently() {
        double[][] states = {{1.0, 0.0}, {2.0, 1.0}};
        double[] targets = {1.0, 3.0};

        double[] readout = EchoStateNetwork.trainReadout(states, targets, 0.01);

        assertThat(readout[0]).isCloseTo(7.0 / 5.01, within(1e-12));
        assertThat(readout[1]).isCloseTo(3.0 / 1.01, within(1e-12));
    }

    @Test
    void trainReadout_lengthMismatch_rejected() {
        assertThatThrownBy(() -> EchoStateNetwork.trainReadout(new double[2][3], new double[1], 0.01))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void predict_clampsNegativeOutputToZero() {
        assertThat(EchoStateNetwork.predict(new double[]{1.0, 1.0}, new double[]{-2.0, 1.0})).isZero();
        assertThat(EchoStateNetwork.predict(new double[]{1.0, 2.0}, new double[]{0.5, 1.0})).isEqualTo(2.5);
    }

    @Test
    void normalizedSeries_flatSeriesUsesUnitStd() {
        NormalizedSeries flat = NormalizedSeries.of(new double[]{5.0, 5.0});
        assertThat(flat.std()).isEqualTo(1.0);
        assertThat(flat.values()).containsExactly(0.0, 0.0);

        NormalizedSeries spread = NormalizedSeries.of(new double[]{2.0, 4.0});
        assertThat(spread.mean()).isEqualTo(3.0);
        assertThat(spread.values()).containsExactly(-1.0, 1.0);
        assertThat(spread.denormalize(1.0)).isEqualTo(4.0);
    }
}
