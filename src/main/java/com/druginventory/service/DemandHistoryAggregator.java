package com.druginventory.service;

import com.druginventory.model.DrugProfile;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.InventoryBatch;
import com.druginventory.model.MovementType;
import com.druginventory.model.StockMovement;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns raw movements into a daily outbound series for one drug profile, summed across all of its batches.
 */
@Service
public class DemandHistoryAggregator {

    static final long DEFAULT_SHELF_LIFE_DAYS = 365;

    public List<HistoricalDemandPoint> buildDailySeries(
            List<StockMovement> movements, List<InventoryBatch> batches, DrugProfile profile) {

        List<InventoryBatch> matching = batches == null ? List.of() : batches.stream()
            .filter(profile::matches)
            .toList();
        if (matching.isEmpty()) {
            return List.of();
        }

        Set<String> batchIds = matching.stream()
            .map(InventoryBatch::getId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());

        Map<LocalDate, Integer> daily = new TreeMap<>();
        if (movements != null) {
            for (StockMovement movement : movements) {
                if (movement.getType() != MovementType.OUT
                        || movement.getDate() == null
                        || !batchIds.contains(movement.getInventoryItemId())) {
                    continue;
                }
                daily.merge(movement.getDate().toLocalDate(), movement.getQuantity(), Integer::sum);
            }
        }

        // Optimistic reference: the freshest lot on hand.
        LocalDate referenceExpiry = matching.stream()
            .map(InventoryBatch::getExpiryDate)
            .filter(Objects::nonNull)
            .max(LocalDate::compareTo)
            .orElse(null);

        return daily.entrySet().stream()
            .map(e -> HistoricalDemandPoint.builder()
                .date(e.getKey())
                .stockOutVolume(e.getValue())
                .remainingShelfLife(shelfLife(e.getKey(), referenceExpiry))
                .build())
            .toList();
    }

    private long shelfLife(LocalDate day, LocalDate referenceExpiry) {
        if (referenceExpiry == null) {
            return DEFAULT_SHELF_LIFE_DAYS;
        }
        return Math.max(0, ChronoUnit.DAYS.between(day, referenceExpiry));
    }
}
