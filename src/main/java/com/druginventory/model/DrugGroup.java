package com.druginventory.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * All batches of one drug profile. {@code batches} is always in FEFO order.
 */
@Value
@Builder
public class DrugGroup {
    String genericName;
    String brandName;
    String strength;
    int totalQuantity;
    int reorderLevel;
    List<BatchSummary> batches;

    public DrugProfile profile() {
        return DrugProfile.of(genericName, brandName, strength);
    }
}
