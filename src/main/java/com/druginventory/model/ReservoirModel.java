package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Echo state network parameters. {@code weights} is N x N, {@code inputWeights} is N x F
 * (F input features), {@code state} and {@code readoutWeights} have length N.
 * Arrays are never modified after construction; updates produce new instances.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReservoirModel {
    double[][] weights;
    double[][] inputWeights;
    double[] state;
    double[] readoutWeights;
    double mean;
    @Builder.Default
    double std = 1.0;
    double lastError;
    int trainingSamples;

    @JsonIgnore
    public int size() {
        return weights != null ? weights.length : 0;
    }

    /** Every recurrent row is present and N wide. */
    @JsonIgnore
    public boolean isSquare() {
        return weights != null && hasRows(weights, weights.length);
    }

    /** One projection row per neuron, each {@code inputFeatures} wide. */
    public boolean hasInputProjection(int inputFeatures) {
        return inputWeights != null && inputWeights.length == size() && hasRows(inputWeights, inputFeatures);
    }

    private static boolean hasRows(double[][] matrix, int width) {
        for (double[] row : matrix) {
            if (row == null || row.length != width) {
                return false;
            }
        }
        return true;
    }
}
