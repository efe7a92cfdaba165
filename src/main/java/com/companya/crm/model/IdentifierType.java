package com.companya.crm.model;

public enum IdentifierType {
    EMAIL,
    PHONE
}
