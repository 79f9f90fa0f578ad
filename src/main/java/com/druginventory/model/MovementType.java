package com.druginventory.model;

public enum MovementType {
    IN,
    OUT
}
