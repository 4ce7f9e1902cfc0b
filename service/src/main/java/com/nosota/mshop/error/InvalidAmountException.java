package com.nosota.mshop.error;

/**
 * Deposit or withdrawal amount missing or not positive.
 */
public class InvalidAmountException extends Exception {
    public InvalidAmountException(String message) {
        super(message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(message, cause);
    }
}
