package com.nosota.mshop.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of an account.
 * <p>
 * Rendered lowercase on the wire ({@code "user"}, {@code "admin"}); stored by name.
 * </p>
 */
public enum UserRole {
    /**
     * Regular shopper. Every self-registered account gets this role.
     */
    USER("user"),

    /**
     * Catalog manager. Created once by the startup bootstrap.
     */
    ADMIN("admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
