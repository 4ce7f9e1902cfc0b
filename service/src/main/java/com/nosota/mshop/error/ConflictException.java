package com.nosota.mshop.error;

/**
 * A username or email is already taken.
 */
public class ConflictException extends Exception {
    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
