package com.warehouse.requisitions.model;

public enum Decision {
    APPROVE,
    REJECT
}
