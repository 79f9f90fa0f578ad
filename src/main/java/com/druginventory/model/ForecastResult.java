package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResult {
    String drugId;
    String genericName;
    String brandName;
    String strength;
    int currentStock;
    List<PredictionPoint> predictions;
    int safetyStock;
    int reorderPoint;
    List<ExpiryWarning> expiryWarnings;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate nextRestockDate;
    RiskLevel riskLevel;
    double modelConfidence;
    MarkovState markovState;
    ForecastMethod method;
    int historyDays;
    ReservoirModel model;

    public DrugProfile profile() {
        return DrugProfile.of(genericName, brandName, strength);
    }
}
