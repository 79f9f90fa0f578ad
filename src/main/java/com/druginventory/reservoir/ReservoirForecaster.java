package com.druginventory.reservoir;

import com.druginventory.exception.InventoryInputException;
import com.druginventory.model.ForecastConfig;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.PredictionPoint;
import com.druginventory.model.ReservoirModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Trains a readout on a profile's daily demand and rolls the forecast forward day by day,
 * feeding each normalized prediction back into the reservoir.
 */
@Slf4j
@Component
public class ReservoirForecaster {

    /** Normalized demand plus a position-in-sequence feature. */
    public static final int INPUT_FEATURES = 2;

    static final double CONFIDENCE_BAND_FACTOR = 0.2;

    public ReservoirRun forecast(List<HistoricalDemandPoint> series, int currentStock,
                                 ForecastConfig config, ReservoirModel storedModel, LocalDate startDate) {
        double[] demands = series.stream().mapToDouble(HistoricalDemandPoint::getStockOutVolume).toArray();
        NormalizedSeries normalized = NormalizedSeries.of(demands);
        ReservoirModel reservoir = resolveReservoir(config, storedModel);
        int n = normalized.length();

        double[] state = new double[reservoir.size()];
        double[][] stateHistory = new double[Math.max(0, n - 1)][];
        double[] targets = new double[Math.max(0, n - 1)];
        for (int i = 0; i < n - 1; i++) {
            double[] input = {normalized.values()[i], (double) i / n};
            state = step(state, input, reservoir, config);
            stateHistory[i] = state;
            targets[i] = normalized.values()[i + 1];
        }

        double[] readout = EchoStateNetwork.trainReadout(stateHistory, targets, config.getRidgeRegularization());
        double trainingError = inSampleRmse(stateHistory, targets, readout);
        log.debug("Readout trained | samples={} | reservoirSize={} | trainingRmse={}",
            targets.length, reservoir.size(), trainingError);

        List<PredictionPoint> predictions = new ArrayList<>(config.getForecastHorizon());
        double stock = currentStock;
        double confidence = normalized.std() * CONFIDENCE_BAND_FACTOR;
        for (int day = 0; day < config.getForecastHorizon(); day++) {
            double normalizedPrediction = EchoStateNetwork.predict(state, readout);
            double predictedDemand = Math.max(0.0, normalized.denormalize(normalizedPrediction));
            stock = Math.max(0.0, stock - predictedDemand);

            predictions.add(PredictionPoint.builder()
                .date(startDate.plusDays(day))
                .predictedDemand(round1(predictedDemand))
                .confidenceLower(round2(Math.max(0.0, predictedDemand - confidence)))
                .confidenceUpper(round2(predictedDemand + confidence))
                .stockLevel(round1(stock))
                .build());

            double[] nextInput = {
                normalizedPrediction,
                (double) (n + day) / (n + config.getForecastHorizon())
            };
            state = step(state, nextInput, reservoir, config);
        }

        ReservoirModel trained = reservoir.toBuilder()
            .state(state)
            .readoutWeights(readout)
            .mean(normalized.mean())
            .std(normalized.std())
            .lastError(trainingError)
            .trainingSamples(targets.length)
            .build();
        return new ReservoirRun(predictions, trained);
    }

    /**
     * A stored model supplies the reservoir dynamics; otherwise a fresh reservoir is seeded from the config.
     * A missing or misshapen input projection is re-seeded.
     *
     * @throws InventoryInputException if the stored recurrent matrix is not N x N
     */
    ReservoirModel resolveReservoir(ForecastConfig config, ReservoirModel storedModel) {
        if (storedModel == null || storedModel.size() == 0) {
            return EchoStateNetwork.initialize(config, INPUT_FEATURES);
        }
        if (!storedModel.isSquare()) {
            throw new InventoryInputException(
                "storedModel.weights must be a square matrix of " + storedModel.size() + " x " + storedModel.size());
        }
        if (storedModel.hasInputProjection(INPUT_FEATURES)) {
            return storedModel;
        }
        log.debug("Re-seeding input projection for stored model | reservoirSize={}", storedModel.size());
        Random random = new Random(config.getRandomSeed());
        return storedModel.toBuilder()
            .inputWeights(EchoStateNetwork.inputProjection(storedModel.size(), INPUT_FEATURES, random))
            .build();
    }

    private double[] step(double[] state, double[] input, ReservoirModel reservoir, ForecastConfig config) {
        return EchoStateNetwork.updateState(state, input, reservoir.getWeights(), reservoir.getInputWeights(),
            config.getInputScaling(), config.getLeakingRate());
    }

    private double inSampleRmse(double[][] states, double[] targets, double[] readout) {
        if (targets.length == 0) {
            return 0.0;
        }
        double squared = 0.0;
        for (int t = 0; t < targets.length; t++) {
            double error = EchoStateNetwork.predict(states[t], readout) - targets[t];
            squared += error * error;
        }
        return Math.sqrt(squared / targets.length);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record ReservoirRun(List<PredictionPoint> predictions, ReservoirModel model) {}
}
