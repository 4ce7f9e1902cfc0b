package com.nosota.mshop.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of balance-affecting event recorded in the ledger.
 */
public enum TransactionType {
    /**
     * Funds added to the wallet.
     */
    DEPOSIT("deposit"),

    /**
     * Funds taken out of the wallet.
     */
    WITHDRAW("withdraw"),

    /**
     * Funds spent on a catalog item. The entry carries the item id.
     */
    PURCHASE("purchase");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Sign of the wallet delta this kind of entry applies: +1 for credits, -1 for debits.
     */
    public int direction() {
        return this == DEPOSIT ? 1 : -1;
    }
}
