package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class HistoricalDemandPoint {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    int stockOutVolume;
    long remainingShelfLife;
}
