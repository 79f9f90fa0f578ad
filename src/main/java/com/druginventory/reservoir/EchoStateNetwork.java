package com.druginventory.reservoir;

import com.druginventory.model.ForecastConfig;
import com.druginventory.model.ReservoirModel;

import java.util.Random;

/**
 * Numeric kernel of the echo state network: reservoir construction, leaky-integrator state update,
 * per-dimension ridge readout and linear prediction. All methods are pure; arrays passed in are not modified.
 */
public final class EchoStateNetwork {

    private EchoStateNetwork() {
    }

    /**
     * Builds a sparse random reservoir and input projection from {@code config.randomSeed}.
     * The recurrent matrix is rescaled by {@code spectralRadius / maxAbsRowSum}, an upper-bound
     * approximation of the true spectral radius.
     */
    public static ReservoirModel initialize(ForecastConfig config, int inputFeatures) {
        int size = config.getReservoirSize();
        Random random = new Random(config.getRandomSeed());

        double[][] weights = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                weights[i][j] = random.nextDouble() < config.getReservoirDensity()
                    ? (random.nextDouble() - 0.5) * 2
                    : 0.0;
            }
        }
        scaleToSpectralRadius(weights, config.getSpectralRadius());

        return ReservoirModel.builder()
            .weights(weights)
            .inputWeights(inputProjection(size, inputFeatures, random))
            .state(new double[size])
            .readoutWeights(new double[size])
            .build();
    }

    static double[][] inputProjection(int size, int inputFeatures, Random random) {
        double[][] projection = new double[size][inputFeatures];
        for (int i = 0; i < size; i++) {
            for (int f = 0; f < inputFeatures; f++) {
                projection[i][f] = (random.nextDouble() - 0.5) * 2;
            }
        }
        return projection;
    }

    static void scaleToSpectralRadius(double[][] weights, double targetRadius) {
        double maxRowSum = 0.0;
        for (double[] row : weights) {
            double sum = 0.0;
            for (double v : row) {
                sum += Math.abs(v);
            }
            maxRowSum = Math.max(maxRowSum, sum);
        }
        if (maxRowSum == 0.0) {
            return;
        }
        double scale = targetRadius / maxRowSum;
        for (double[] row : weights) {
            for (int j = 0; j < row.length; j++) {
                row[j] *= scale;
            }
        }
    }

    /**
     * One reservoir step: {@code x'[i] = (1 - a) * x[i] + a * tanh(W_in[i] . u * s + W[i] . x)}.
     */
    public static double[] updateState(double[] currentState, double[] input, double[][] weights,
                                       double[][] inputWeights, double inputScaling, double leakingRate) {
        int size = currentState.length;
        double[] next = new double[size];
        for (int i = 0; i < size; i++) {
            double activation = 0.0;
            for (int f = 0; f < input.length; f++) {
                activation += input[f] * inputScaling * inputWeights[i][f];
            }
            for (int j = 0; j < size; j++) {
                activation += weights[i][j] * currentState[j];
            }
            next[i] = (1 - leakingRate) * currentState[i] + leakingRate * Math.tanh(activation);
        }
        return next;
    }

    /**
     * Fits one coefficient per state dimension independently:
     * {@code w[i] = sum(x_t[i] * y_t) / (sum(x_t[i]^2) + lambda)}.
     * This ignores cross-dimension covariance; it is not a full multivariate ridge solve.
     */
    public static double[] trainReadout(double[][] states, double[] targets, double regularization) {
        if (states.length != targets.length) {
            throw new IllegalArgumentException(
                "state and target histories differ in length: " + states.length + " vs " + targets.length);
        }
        if (states.length == 0) {
            return new double[0];
        }
        int dims = states[0].length;
        double[] readout = new double[dims];
        for (int i = 0; i < dims; i++) {
            double numerator = 0.0;
            double denominator = regularization;
            for (int t = 0; t < states.length; t++) {
                numerator += states[t][i] * targets[t];
                denominator += states[t][i] * states[t][i];
            }
            readout[i] = denominator == 0.0 ? 0.0 : numerator / denominator;
        }
        return readout;
    }

    /** Dot product of state and readout, clamped at zero. */
    public static double predict(double[] state, double[] readoutWeights) {
        double output = 0.0;
        int n = Math.min(state.length, readoutWeights.length);
        for (int i = 0; i < n; i++) {
            output += state[i] * readoutWeights[i];
        }
        return Math.max(0.0, output);
    }
}
