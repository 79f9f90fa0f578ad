package com.druginventory.exception;

import com.druginventory.model.DrugProfile;
import lombok.Getter;

/**
 * A dispensing request cannot be met. No allocation accompanies this failure.
 */
@Getter
public class InsufficientStockException extends InventoryIntelligenceException {

    private final String target;
    private final int requested;
    private final int available;

    private InsufficientStockException(String target, int requested, int available, String message) {
        super("INSUFFICIENT_STOCK", message);
        this.target = target;
        this.requested = requested;
        this.available = available;
    }

    public static InsufficientStockException forProfile(DrugProfile profile, int requested, int available) {
        return new InsufficientStockException(profile.key(), requested, available,
            "Insufficient stock for '" + profile.key() + "': requested " + requested
                + ", available " + available + ".");
    }

    public static InsufficientStockException forBatch(String batchId, int requested, int available) {
        return new InsufficientStockException(batchId, requested, available,
            "Insufficient stock in batch '" + batchId + "': requested " + requested
                + ", available " + available + ".");
    }
}
