package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class PredictionPoint {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    double predictedDemand;
    double confidenceLower;
    double confidenceUpper;
    double stockLevel;
}
