package com.companya.crm.model;

public enum FlagPriority {
    HIGH,
    MEDIUM,
    LOW
}
