package com.druginventory.service;

import com.druginventory.model.ActivityRegime;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.MarkovState;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RegimeClassifierTest {

    private final RegimeClassifier classifier = new RegimeClassifier();

    private List<HistoricalDemandPoint> series(int... volumes) {
        List<HistoricalDemandPoint> points = new ArrayList<>();
        LocalDate day = LocalDate.of(2025, 1, 1);
        for (int volume : volumes) {
            points.add(HistoricalDemandPoint.builder()
                .date(day).stockOutVolume(volume).remainingShelfLife(100).build());
            day = day.plusDays(1);
        }
        return points;
    }

    @Test
    void classify_thresholdsSplitLowNormalHigh() {
        assertThat(classifier.classify(series(1, 2, 3), null).getCurrent()).isEqualTo(ActivityRegime.LOW_ACTIVITY);
        assertThat(classifier.classify(series(3, 3), null).getCurrent()).isEqualTo(ActivityRegime.NORMAL_ACTIVITY);
        assertThat(classifier.classify(series(7, 8, 9), null).getCurrent()).isEqualTo(ActivityRegime.HIGH_ACTIVITY);
    }

    @Test
    void classify_onlyLastSevenDaysCount() {
        MarkovState state = classifier.classify(series(100, 100, 100, 1, 1, 1, 1, 1, 1, 1), null);

        assertThat(state.getCurrent()).isEqualTo(ActivityRegime.LOW_ACTIVITY);
        assertThat(state.getConsecutiveDays()).isEqualTo(1);
        assertThat(state.getTransitionCounts()).isEmpty();
    }

    @Test
    void classify_emptySeries_defaultsToLowActivity() {
        MarkovState state = classifier.classify(List.of(), null);

        assertThat(state.getCurrent()).isEqualTo(ActivityRegime.LOW_ACTIVITY);
        assertThat(state.getConsecutiveDays()).isZero();
    }

    @Test
    void classify_withPreviousState_recordsTransitionAndExtendsStreak() {
        MarkovState previous = MarkovState.builder()
            .current(ActivityRegime.HIGH_ACTIVITY)
            .transitionCounts(Map.of("normal_activity_to_high_activity", 2))
            .consecutiveDays(4)
            .build();

        MarkovState same = classifier.classify(series(10, 12), previous);
        assertThat(same.getConsecutiveDays()).isEqualTo(5);
        assertThat(same.getTransitionCounts())
            .containsEntry("high_activity_to_high_activity", 1)
            .containsEntry("normal_activity_to_high_activity", 2);

        MarkovState changed = classifier.classify(series(1), previous);
        assertThat(changed.getCurrent()).isEqualTo(ActivityRegime.LOW_ACTIVITY);
        assertThat(changed.getConsecutiveDays()).isEqualTo(1);
        assertThat(changed.getTransitionCounts()).containsEntry("high_activity_to_low_activity", 1);
    }

    @Test
    void classify_emptySeriesKeepsPreviousCounts() {
        MarkovState previous = MarkovState.builder()
            .current(ActivityRegime.NORMAL_ACTIVITY)
            .transitionCounts(Map.of("low_activity_to_normal_activity", 3))
            .consecutiveDays(2)
            .build();

        MarkovState state = classifier.classify(List.of(), previous);

        assertThat(state.getTransitionCounts()).containsExactlyEntriesOf(Map.of("low_activity_to_normal_activity", 3));
    }
}
