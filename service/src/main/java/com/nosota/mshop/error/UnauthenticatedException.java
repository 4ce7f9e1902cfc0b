package com.nosota.mshop.error;

/**
 * Bearer token missing, malformed, expired, badly signed, or pointing at a user that no longer exists.
 */
public class UnauthenticatedException extends Exception {
    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
