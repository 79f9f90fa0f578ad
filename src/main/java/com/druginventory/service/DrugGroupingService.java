package com.druginventory.service;

import com.druginventory.model.BatchSummary;
import com.druginventory.model.DrugGroup;
import com.druginventory.model.DrugProfile;
import com.druginventory.model.InventoryBatch;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DrugGroupingService {

    /**
     * Partitions batches by drug profile, preserving first-seen profile order.
     * Batches inside each group are listed earliest expiry first, undated last.
     */
    public List<DrugGroup> groupByDrug(List<InventoryBatch> batches) {
        return partition(batches).values().stream()
            .map(this::toGroup)
            .toList();
    }

    /**
     * Batches of each profile, keyed by profile, in first-seen order. Member order follows the input.
     */
    public Map<DrugProfile, List<InventoryBatch>> partition(List<InventoryBatch> batches) {
        Map<DrugProfile, List<InventoryBatch>> grouped = new LinkedHashMap<>();
        if (batches == null) {
            return grouped;
        }
        for (InventoryBatch batch : batches) {
            grouped.computeIfAbsent(batch.getProfile(), p -> new ArrayList<>()).add(batch);
        }
        return grouped;
    }

    public List<InventoryBatch> batchesOf(List<InventoryBatch> batches, DrugProfile profile) {
        if (batches == null) {
            return List.of();
        }
        return batches.stream().filter(profile::matches).toList();
    }

    private DrugGroup toGroup(List<InventoryBatch> members) {
        InventoryBatch first = members.get(0);
        int total = members.stream().mapToInt(InventoryBatch::getQuantity).sum();
        List<BatchSummary> summaries = members.stream()
            .sorted(InventoryBatch.FEFO_ORDER)
            .map(b -> BatchSummary.builder()
                .id(b.getId())
                .batchNumber(b.getBatchNumber())
                .quantity(b.getQuantity())
                .expiryDate(b.getExpiryDate())
                .dateReceived(b.getDateReceived())
                .build())
            .toList();

        return DrugGroup.builder()
            .genericName(first.getGenericName())
            .brandName(first.getBrandName())
            .strength(first.getStrength())
            .totalQuantity(total)
            .reorderLevel(first.getReorderLevel())
            .batches(summaries)
            .build();
    }
}
