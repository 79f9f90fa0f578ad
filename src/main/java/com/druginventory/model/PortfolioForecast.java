package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class PortfolioForecast {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int profileCount;
    int criticalOrHighCount;
    double averageModelConfidence;
    List<AtRiskDrug> atRisk;
    List<ForecastResult> forecasts;
}
