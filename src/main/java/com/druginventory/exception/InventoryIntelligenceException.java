package com.druginventory.exception;

import lombok.Getter;

@Getter
public abstract class InventoryIntelligenceException extends RuntimeException {
    private final String errorCode;
    protected InventoryIntelligenceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
