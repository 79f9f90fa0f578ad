package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Ordered from least to most severe. */
public enum RiskLevel {
    LOW(10),
    MEDIUM(20),
    HIGH(30),
    CRITICAL(40);

    private final int scorePoints;

    RiskLevel(int scorePoints) {
        this.scorePoints = scorePoints;
    }

    public int getScorePoints() {
        return scorePoints;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
