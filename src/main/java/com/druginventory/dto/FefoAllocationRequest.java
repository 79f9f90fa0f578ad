package com.druginventory.dto;

import com.druginventory.model.DrugProfile;
import com.druginventory.model.InventoryBatch;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class FefoAllocationRequest {

    @NotNull(message = "batches is required")
    List<@Valid InventoryBatch> batches;

    @NotBlank(message = "genericName is required")
    String genericName;

    String brandName;

    String strength;

    @Min(value = 0, message = "quantity must be >= 0")
    int quantity;

    public DrugProfile profile() {
        return DrugProfile.of(genericName, brandName, strength);
    }
}
