package com.nosota.mshop.error;

/**
 * The wallet holds less than the operation needs. Carries both figures for the client.
 */
public class InsufficientBalanceException extends Exception {
    private final long required;
    private final long balance;

    public InsufficientBalanceException(long required, long balance) {
        super("Insufficient balance");
        this.required = required;
        this.balance = balance;
    }

    public long getRequired() {
        return required;
    }

    public long getBalance() {
        return balance;
    }
}
