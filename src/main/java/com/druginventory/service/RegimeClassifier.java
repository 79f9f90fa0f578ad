package com.druginventory.service;

import com.druginventory.model.ActivityRegime;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.MarkovState;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the trailing week of demand into an activity regime. Pure: the previous state, when
 * threaded through by the caller, only seeds transition counts and the streak length.
 */
@Service
public class RegimeClassifier {

    static final int WINDOW_DAYS = 7;
    static final double LOW_ACTIVITY_CEILING = 3.0;
    static final double NORMAL_ACTIVITY_CEILING = 8.0;

    public MarkovState classify(List<HistoricalDemandPoint> series, MarkovState previousState) {
        Map<String, Integer> counts = new HashMap<>();
        if (previousState != null && previousState.getTransitionCounts() != null) {
            counts.putAll(previousState.getTransitionCounts());
        }

        List<HistoricalDemandPoint> recent = series == null ? List.of()
            : series.subList(Math.max(0, series.size() - WINDOW_DAYS), series.size());
        if (recent.isEmpty()) {
            return MarkovState.builder()
                .current(ActivityRegime.LOW_ACTIVITY)
                .transitionCounts(Map.copyOf(counts))
                .consecutiveDays(0)
                .build();
        }

        double average = recent.stream().mapToInt(HistoricalDemandPoint::getStockOutVolume).average().orElse(0.0);
        ActivityRegime current = regimeFor(average);

        int consecutiveDays = 1;
        if (previousState != null && previousState.getCurrent() != null) {
            counts.merge(MarkovState.transitionKey(previousState.getCurrent(), current), 1, Integer::sum);
            if (previousState.getCurrent() == current) {
                consecutiveDays = previousState.getConsecutiveDays() + 1;
            }
        }

        return MarkovState.builder()
            .current(current)
            .transitionCounts(Map.copyOf(counts))
            .consecutiveDays(consecutiveDays)
            .build();
    }

    ActivityRegime regimeFor(double averageDemand) {
        if (averageDemand < LOW_ACTIVITY_CEILING) {
            return ActivityRegime.LOW_ACTIVITY;
        }
        if (averageDemand < NORMAL_ACTIVITY_CEILING) {
            return ActivityRegime.NORMAL_ACTIVITY;
        }
        return ActivityRegime.HIGH_ACTIVITY;
    }
}
