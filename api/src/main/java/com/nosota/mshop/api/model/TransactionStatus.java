package com.nosota.mshop.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ledger entry status.
 * Entries are written once the wallet change is applied, so every stored entry is {@link #COMPLETED}.
 */
public enum TransactionStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    TransactionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
