package com.druginventory.dto;

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
public class BatchAllocationRequest {

    @NotNull(message = "batches is required")
    List<@Valid InventoryBatch> batches;

    @NotBlank(message = "batchId is required")
    String batchId;

    @Min(value = 0, message = "quantity must be >= 0")
    int quantity;
}
