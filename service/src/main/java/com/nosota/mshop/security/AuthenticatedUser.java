package com.nosota.mshop.security;

import com.nosota.mshop.api.model.UserRole;

/**
 * Principal of an authenticated request, built from the user row read for that request.
 */
public record AuthenticatedUser(
        Long id,
        String username,
        UserRole role
) {}
