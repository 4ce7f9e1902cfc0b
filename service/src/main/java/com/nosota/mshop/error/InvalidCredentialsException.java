package com.nosota.mshop.error;

/**
 * Login failed. The message is the same whether the username or the password was wrong.
 */
public class InvalidCredentialsException extends Exception {
    public InvalidCredentialsException(String message) {
        super(message);
    }

    public InvalidCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
