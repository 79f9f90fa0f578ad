package com.druginventory.model;

import lombok.Value;

import java.util.Objects;

/**
 * Identity shared by every batch of the same medicine: generic name, brand name and strength.
 * Matching is exact and case-sensitive.
 */
@Value(staticConstructor = "of")
public class DrugProfile {
    String genericName;
    String brandName;
    String strength;

    public String key() {
        return genericName + "|" + brandName + "|" + strength;
    }

    public boolean matches(InventoryBatch batch) {
        return batch != null
            && Objects.equals(genericName, batch.getGenericName())
            && Objects.equals(brandName, batch.getBrandName())
            && Objects.equals(strength, batch.getStrength());
    }
}
