package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ExpiryWarning {
    String batchId;
    String batchNumber;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate expiryDate;
    int quantity;
    long daysUntilExpiry;
}
