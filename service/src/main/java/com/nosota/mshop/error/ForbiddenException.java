package com.nosota.mshop.error;

public class ForbiddenException extends Exception {
    public ForbiddenException(String message) {
        super(message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(message, cause);
    }
}
