package com.druginventory.service;

import com.druginventory.exception.InsufficientStockException;
import com.druginventory.exception.InventoryInputException;
import com.druginventory.model.BatchAllocation;
import com.druginventory.model.DrugProfile;
import com.druginventory.model.InventoryBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which lots satisfy a dispensing request. Never mutates the supplied batches;
 * the caller applies the returned allocations to its own stock records.
 */
@Slf4j
@Service
public class FefoAllocationService {

    /**
     * Draws {@code requestedQuantity} units of {@code profile} from the earliest-expiring batches first.
     * A later-expiring batch is touched only after every earlier one is exhausted.
     *
     * @throws InsufficientStockException if the profile's total on-hand quantity is below the request
     */
    public List<BatchAllocation> allocateFefo(List<InventoryBatch> batches, DrugProfile profile, int requestedQuantity) {
        requireNonNegative(requestedQuantity);

        List<InventoryBatch> available = (batches == null ? List.<InventoryBatch>of() : batches).stream()
            .filter(profile::matches)
            .filter(b -> b.getQuantity() > 0)
            .sorted(InventoryBatch.FEFO_ORDER)
            .toList();

        int totalAvailable = available.stream().mapToInt(InventoryBatch::getQuantity).sum();
        if (totalAvailable < requestedQuantity) {
            log.warn("FEFO allocation rejected | profile={} | requested={} | available={}",
                profile.key(), requestedQuantity, totalAvailable);
            throw InsufficientStockException.forProfile(profile, requestedQuantity, totalAvailable);
        }

        List<BatchAllocation> allocations = new ArrayList<>();
        int remaining = requestedQuantity;
        for (InventoryBatch batch : available) {
            if (remaining <= 0) {
                break;
            }
            int drawn = Math.min(batch.getQuantity(), remaining);
            allocations.add(toAllocation(batch, drawn));
            remaining -= drawn;
        }

        log.debug("FEFO allocation | profile={} | requested={} | batches={}",
            profile.key(), requestedQuantity, allocations.size());
        return allocations;
    }

    /**
     * Draws the whole request from one named batch, bypassing FEFO ordering.
     *
     * @throws InsufficientStockException if the batch is unknown or holds fewer units than requested
     */
    public BatchAllocation allocateSpecificBatch(List<InventoryBatch> batches, String batchId, int requestedQuantity) {
        requireNonNegative(requestedQuantity);

        InventoryBatch batch = (batches == null ? List.<InventoryBatch>of() : batches).stream()
            .filter(b -> b.getId() != null && b.getId().equals(batchId))
            .findFirst()
            .orElse(null);

        int available = batch != null ? batch.getQuantity() : 0;
        if (batch == null || available < requestedQuantity) {
            log.warn("Specific batch allocation rejected | batchId={} | requested={} | available={}",
                batchId, requestedQuantity, available);
            throw InsufficientStockException.forBatch(batchId, requestedQuantity, available);
        }
        return toAllocation(batch, requestedQuantity);
    }

    private void requireNonNegative(int requestedQuantity) {
        if (requestedQuantity < 0) {
            throw new InventoryInputException("requested quantity must be >= 0");
        }
    }

    private BatchAllocation toAllocation(InventoryBatch batch, int quantity) {
        return BatchAllocation.builder()
            .inventoryItemId(batch.getId())
            .batchNumber(batch.getBatchNumber())
            .genericName(batch.getGenericName())
            .brandName(batch.getBrandName())
            .strength(batch.getStrength())
            .quantity(quantity)
            .expiryDate(batch.getExpiryDate())
            .build();
    }
}
