package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AtRiskDrug {
    String genericName;
    String brandName;
    String strength;
    RiskLevel riskLevel;
    int riskScore;
    int currentStock;
    int reorderPoint;
    String mostCriticalBatchNumber;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate mostCriticalExpiry;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate nextRestockDate;
}
