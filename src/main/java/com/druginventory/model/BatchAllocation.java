package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class BatchAllocation {
    String inventoryItemId;
    String batchNumber;
    String genericName;
    String brandName;
    String strength;
    int quantity;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate expiryDate;
}
