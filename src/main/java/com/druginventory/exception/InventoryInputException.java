package com.druginventory.exception;

public class InventoryInputException extends InventoryIntelligenceException {
    public InventoryInputException(String message) {
        super("INVENTORY_INPUT_ERROR", message);
    }
}
