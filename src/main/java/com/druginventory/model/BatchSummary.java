package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class BatchSummary {
    String id;
    String batchNumber;
    int quantity;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate expiryDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate dateReceived;
}
