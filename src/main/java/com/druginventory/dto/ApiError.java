package com.druginventory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed call. {@code errorCode} is the stable machine-readable code of the
 * {@code InventoryIntelligenceException} that caused it (e.g. {@code INSUFFICIENT_STOCK}), or
 * {@code VALIDATION_ERROR} / {@code INTERNAL_ERROR}; absent for malformed requests.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    int    status;
    String error;
    String errorCode;
    String message;
    String path;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
    List<FieldError> fieldErrors;

    @Value
    @Builder
    public static class FieldError {
        String field;
        Object rejectedValue;
        String message;
    }
}
