package com.druginventory.dto;

import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.MarkovState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DemandHistoryResponse {
    String profileKey;
    int historyDays;
    long totalStockOut;
    List<HistoricalDemandPoint> series;
    MarkovState markovState;
}
