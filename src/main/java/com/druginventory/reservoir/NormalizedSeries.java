package com.druginventory.reservoir;

/**
 * Zero-mean, unit-variance view of a demand series. Population standard deviation; a flat series uses std 1.
 */
public record NormalizedSeries(double[] values, double mean, double std) {

    public static NormalizedSeries of(double[] data) {
        if (data.length == 0) {
            return new NormalizedSeries(new double[0], 0.0, 1.0);
        }
        double sum = 0.0;
        for (double v : data) {
            sum += v;
        }
        double mean = sum / data.length;
        double squares = 0.0;
        for (double v : data) {
            squares += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(squares / data.length);
        if (std == 0.0) {
            std = 1.0;
        }
        double[] normalized = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            normalized[i] = (data[i] - mean) / std;
        }
        return new NormalizedSeries(normalized, mean, std);
    }

    public double denormalize(double value) {
        return value * std + mean;
    }

    public int length() {
        return values.length;
    }
}
