package com.druginventory.exception;

import com.druginventory.model.DrugProfile;

public class DrugProfileNotFoundException extends InventoryIntelligenceException {
    public DrugProfileNotFoundException(DrugProfile profile) {
        super("NO_MATCHING_DRUG", "No batches found for drug profile '" + profile.key() + "'.");
    }
}
