package com.druginventory.dto;

import com.druginventory.model.InventoryBatch;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class GroupingRequest {

    @NotNull(message = "batches is required")
    List<@Valid InventoryBatch> batches;
}
