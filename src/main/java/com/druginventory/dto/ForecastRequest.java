package com.druginventory.dto;

import com.druginventory.model.DrugProfile;
import com.druginventory.model.InventoryBatch;
import com.druginventory.model.MarkovState;
import com.druginventory.model.ReservoirModel;
import com.druginventory.model.StockMovement;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotBlank(message = "genericName is required")
    String genericName;

    String brandName;

    String strength;

    @NotNull(message = "batches is required")
    List<@Valid InventoryBatch> batches;

    @Builder.Default
    List<@Valid StockMovement> movements = List.of();

    @Valid
    ForecastConfigOverrides config;

    ReservoirModel storedModel;

    MarkovState previousState;

    public DrugProfile profile() {
        return DrugProfile.of(genericName, brandName, strength);
    }
}
