package com.druginventory.service;

import com.druginventory.model.BatchSummary;
import com.druginventory.model.DrugGroup;
import com.druginventory.model.DrugProfile;
import com.druginventory.model.InventoryBatch;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DrugGroupingServiceTest {

    private final DrugGroupingService service = new DrugGroupingService();

    private InventoryBatch batch(String id, String generic, String strength, int qty, LocalDate expiry) {
        return InventoryBatch.builder()
            .id(id).genericName(generic).brandName("Generic").strength(strength)
            .batchNumber("LOT-" + id).quantity(qty).expiryDate(expiry)
            .build();
    }

    @Test
    void groupByDrug_totalsQuantityAndSortsBatchesByExpiry() {
        List<InventoryBatch> batches = List.of(
            batch("p2", "Paracetamol", "500mg", 40, null),
            batch("p1", "Paracetamol", "500mg", 25, LocalDate.of(2025, 8, 1)),
            batch("i1", "Ibuprofen", "200mg", 10, LocalDate.of(2025, 3, 1)),
            batch("p3", "Paracetamol", "500mg", 5, LocalDate.of(2025, 2, 1)));

        List<DrugGroup> groups = service.groupByDrug(batches);

        assertThat(groups).hasSize(2);
        DrugGroup paracetamol = groups.get(0);
        assertThat(paracetamol.getGenericName()).isEqualTo("Paracetamol");
        assertThat(paracetamol.getTotalQuantity()).isEqualTo(70);
        assertThat(paracetamol.getBatches()).extracting(BatchSummary::getId).containsExactly("p3", "p1", "p2");
        assertThat(groups.get(1).getTotalQuantity()).isEqualTo(10);
    }

    @Test
    void groupByDrug_strengthIsPartOfTheKey() {
        List<DrugGroup> groups = service.groupByDrug(List.of(
            batch("a", "Paracetamol", "500mg", 1, null),
            batch("b", "Paracetamol", "250mg", 1, null)));

        assertThat(groups).extracting(DrugGroup::getStrength).containsExactly("500mg", "250mg");
    }

    @Test
    void groupByDrug_reorderLevelDefaultsToTen() {
        List<DrugGroup> groups = service.groupByDrug(List.of(batch("a", "Paracetamol", "500mg", 1, null)));

        assertThat(groups.get(0).getReorderLevel()).isEqualTo(10);
    }

    @Test
    void groupByDrug_emptyInput_yieldsNoGroups() {
        assertThat(service.groupByDrug(List.of())).isEmpty();
        assertThat(service.groupByDrug(null)).isEmpty();
    }

    @Test
    void batchesOf_filtersByExactProfile() {
        List<InventoryBatch> batches = List.of(
            batch("a", "Paracetamol", "500mg", 1, null),
            batch("b", "paracetamol", "500mg", 1, null));

        assertThat(service.batchesOf(batches, DrugProfile.of("Paracetamol", "Generic", "500mg")))
            .extracting(InventoryBatch::getId)
            .containsExactly("a");
    }
}
