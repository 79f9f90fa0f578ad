package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse demand-intensity regime derived from the trailing week of outbound volume.
 */
public enum ActivityRegime {
    LOW_ACTIVITY("low_activity"),
    NORMAL_ACTIVITY("normal_activity"),
    HIGH_ACTIVITY("high_activity");

    private final String label;

    ActivityRegime(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ActivityRegime fromLabel(String value) {
        for (ActivityRegime regime : values()) {
            if (regime.label.equalsIgnoreCase(value) || regime.name().equalsIgnoreCase(value)) {
                return regime;
            }
        }
        throw new IllegalArgumentException("Unknown activity regime: " + value);
    }
}
