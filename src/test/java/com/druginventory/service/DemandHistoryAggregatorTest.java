package com.druginventory.service;

import com.druginventory.model.DrugProfile;
import com.druginventory.model.HistoricalDemandPoint;
import com.druginventory.model.InventoryBatch;
import com.druginventory.model.MovementType;
import com.druginventory.model.StockMovement;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DemandHistoryAggregatorTest {

    private static final DrugProfile METFORMIN = DrugProfile.of("Metformin", "Glucophage", "850mg");

    private final DemandHistoryAggregator aggregator = new DemandHistoryAggregator();

    private InventoryBatch batch(String id, LocalDate expiry) {
        return InventoryBatch.builder()
            .id(id).genericName("Metformin").brandName("Glucophage").strength("850mg")
            .batchNumber("LOT-" + id).quantity(100).expiryDate(expiry)
            .build();
    }

    private StockMovement movement(String batchId, MovementType type, int qty, LocalDateTime at) {
        return StockMovement.builder()
            .id(batchId + "-" + at)
            .inventoryItemId(batchId)
            .type(type)
            .quantity(qty)
            .date(at)
            .build();
    }

    @Test
    void buildDailySeries_sumsOutboundAcrossBatchesPerCalendarDay() {
        List<InventoryBatch> batches = List.of(
            batch("A", LocalDate.of(2025, 3, 1)),
            batch("B", LocalDate.of(2025, 6, 1)));
        List<StockMovement> movements = List.of(
            movement("A", MovementType.OUT, 4, LocalDateTime.of(2025, 1, 2, 9, 15)),
            movement("B", MovementType.OUT, 6, LocalDateTime.of(2025, 1, 2, 17, 40)),
            movement("A", MovementType.OUT, 3, LocalDateTime.of(2025, 1, 1, 11, 0)),
            movement("A", MovementType.IN, 50, LocalDateTime.of(2025, 1, 1, 8, 0)));

        List<HistoricalDemandPoint> series = aggregator.buildDailySeries(movements, batches, METFORMIN);

        assertThat(series).extracting(HistoricalDemandPoint::getDate)
            .containsExactly(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 2));
        assertThat(series).extracting(HistoricalDemandPoint::getStockOutVolume).containsExactly(3, 10);
        assertThat(series.stream().mapToInt(HistoricalDemandPoint::getStockOutVolume).sum()).isEqualTo(13);
    }

    @Test
    void buildDailySeries_shelfLifeMeasuredAgainstLatestExpiry() {
        List<InventoryBatch> batches = List.of(
            batch("A", LocalDate.of(2025, 3, 1)),
            batch("B", LocalDate.of(2025, 6, 1)),
            batch("C", null));
        List<StockMovement> movements = List.of(
            movement("A", MovementType.OUT, 1, LocalDateTime.of(2025, 1, 1, 12, 0)),
            movement("B", MovementType.OUT, 1, LocalDateTime.of(2025, 7, 1, 12, 0)));

        List<HistoricalDemandPoint> series = aggregator.buildDailySeries(movements, batches, METFORMIN);

        assertThat(series).extracting(HistoricalDemandPoint::getRemainingShelfLife).containsExactly(151L, 0L);
    }

    @Test
    void buildDailySeries_undatedBatchesFallBackToDefaultShelfLife() {
        List<HistoricalDemandPoint> series = aggregator.buildDailySeries(
            List.of(movement("A", MovementType.OUT, 2, LocalDateTime.of(2025, 1, 1, 12, 0))),
            List.of(batch("A", null)),
            METFORMIN);

        assertThat(series).singleElement()
            .extracting(HistoricalDemandPoint::getRemainingShelfLife)
            .isEqualTo(DemandHistoryAggregator.DEFAULT_SHELF_LIFE_DAYS);
    }

    @Test
    void buildDailySeries_ignoresMovementsOfOtherProfiles() {
        InventoryBatch otherDrug = batch("X", LocalDate.of(2025, 3, 1)).toBuilder().genericName("Insulin").build();
        List<HistoricalDemandPoint> series = aggregator.buildDailySeries(
            List.of(
                movement("X", MovementType.OUT, 9, LocalDateTime.of(2025, 1, 1, 12, 0)),
                movement("A", MovementType.OUT, 2, LocalDateTime.of(2025, 1, 1, 12, 0))),
            List.of(otherDrug, batch("A", LocalDate.of(2025, 3, 1))),
            METFORMIN);

        assertThat(series).singleElement()
            .extracting(HistoricalDemandPoint::getStockOutVolume)
            .isEqualTo(2);
    }

    @Test
    void buildDailySeries_noMatchingBatches_returnsEmpty() {
        assertThat(aggregator.buildDailySeries(
            List.of(movement("A", MovementType.OUT, 2, LocalDateTime.of(2025, 1, 1, 12, 0))),
            List.of(),
            METFORMIN)).isEmpty();
    }

    @Test
    void buildDailySeries_onlyInboundMovements_returnsEmpty() {
        assertThat(aggregator.buildDailySeries(
            List.of(movement("A", MovementType.IN, 20, LocalDateTime.of(2025, 1, 1, 12, 0))),
            List.of(batch("A", LocalDate.of(2025, 3, 1))),
            METFORMIN)).isEmpty();
    }
}
