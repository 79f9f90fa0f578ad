package com.druginventory.model;

public enum ForecastMethod {
    RESERVOIR,
    FALLBACK
}
