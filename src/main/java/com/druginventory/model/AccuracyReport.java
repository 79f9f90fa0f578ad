package com.druginventory.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccuracyReport {
    long sampleCount;
    Double mae;
    Double rmse;
    Double mape;
    double previousError;
    double errorIncrease;
    double retrainThreshold;
    boolean retrainRecommended;
}
