package com.druginventory.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Regime snapshot. Transition counts are keyed {@code "<from>_to_<to>"} using regime labels.
 */
@Value
@Builder
@Jacksonized
public class MarkovState {
    ActivityRegime current;
    @Builder.Default
    Map<String, Integer> transitionCounts = Map.of();
    int consecutiveDays;

    public static String transitionKey(ActivityRegime from, ActivityRegime to) {
        return from.getLabel() + "_to_" + to.getLabel();
    }
}
