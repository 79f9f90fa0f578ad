package com.druginventory.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Historical stock movement against a single batch. Never mutated by the core.
 */
@Value
@Builder
@Jacksonized
public class StockMovement {

    String id;

    @NotBlank(message = "inventoryItemId is required")
    String inventoryItemId;

    @NotNull(message = "type is required")
    MovementType type;

    @Min(value = 0, message = "quantity must be >= 0")
    int quantity;

    @NotNull(message = "date is required")
    LocalDateTime date;

    String reason;
}
