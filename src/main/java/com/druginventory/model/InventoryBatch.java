package com.druginventory.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * One physical lot of a drug as held by the external inventory collection. Read-only for the core.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InventoryBatch {

    /** Sort key used for batches without an expiry date. */
    public static final LocalDate FAR_FUTURE_EXPIRY = LocalDate.of(9999, 12, 31);

    /** Earliest expiry first; undated batches last. Stable for equal dates. */
    public static final Comparator<InventoryBatch> FEFO_ORDER =
        Comparator.comparing(InventoryBatch::sortableExpiry);

    @NotBlank(message = "id is required")
    String id;

    @NotBlank(message = "genericName is required")
    String genericName;

    String brandName;

    String strength;

    String batchNumber;

    @Min(value = 0, message = "quantity must be >= 0")
    int quantity;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate expiryDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate dateReceived;

    @Builder.Default
    int reorderLevel = 10;

    @JsonIgnore
    public DrugProfile getProfile() {
        return DrugProfile.of(genericName, brandName, strength);
    }

    @JsonIgnore
    public LocalDate sortableExpiry() {
        return expiryDate != null ? expiryDate : FAR_FUTURE_EXPIRY;
    }
}
