package com.druginventory.service;

import com.druginventory.exception.InventoryInputException;
import com.druginventory.model.AccuracyReport;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Compares forecast demand with observed demand and decides when a stored model has degraded enough
 * to warrant retraining.
 */
@Service
public class ForecastAccuracyService {

    /** 0 for empty or mismatched input. */
    public double rmse(List<Double> predictions, List<Double> actuals) {
        if (predictions == null || actuals == null
                || predictions.isEmpty() || predictions.size() != actuals.size()) {
            return 0.0;
        }
        double squared = 0.0;
        for (int i = 0; i < predictions.size(); i++) {
            double error = predictions.get(i) - actuals.get(i);
            squared += error * error;
        }
        return Math.sqrt(squared / predictions.size());
    }

    public boolean shouldRetrain(List<Double> predictions, List<Double> actuals,
                                 double previousError, double threshold) {
        return rmse(predictions, actuals) - previousError > threshold;
    }

    public AccuracyReport evaluate(List<Double> predictions, List<Double> actuals,
                                   double previousError, double threshold) {
        if (predictions == null || actuals == null || predictions.size() != actuals.size()) {
            throw new InventoryInputException("predictions and actuals must have the same length");
        }
        if (predictions.isEmpty()) {
            return AccuracyReport.builder()
                .sampleCount(0)
                .previousError(previousError)
                .retrainThreshold(threshold)
                .build();
        }

        double absErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;
        for (int i = 0; i < predictions.size(); i++) {
            double actual = actuals.get(i);
            double error = predictions.get(i) - actual;
            absErrorSum += Math.abs(error);
            if (actual != 0.0d) {
                apeSum += Math.abs(error / actual);
                apeCount++;
            }
        }

        double rmse = rmse(predictions, actuals);
        double increase = rmse - previousError;
        return AccuracyReport.builder()
            .sampleCount(predictions.size())
            .mae(round(absErrorSum / predictions.size()))
            .rmse(round(rmse))
            .mape(apeCount > 0 ? round(apeSum / apeCount * 100.0) : null)
            .previousError(previousError)
            .errorIncrease(round(increase))
            .retrainThreshold(threshold)
            .retrainRecommended(increase > threshold)
            .build();
    }

    private double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
