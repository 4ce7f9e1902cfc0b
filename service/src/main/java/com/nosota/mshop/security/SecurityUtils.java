package com.nosota.mshop.security;

import com.nosota.mshop.error.UnauthenticatedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the caller of the current request.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * The authenticated caller.
     *
     * @throws UnauthenticatedException if the request carries no valid bearer token
     */
    public static AuthenticatedUser currentUser() throws UnauthenticatedException {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser) {
            return (AuthenticatedUser) authentication.getPrincipal();
        }
        throw new UnauthenticatedException(AccessControlService.UNAUTHENTICATED_MESSAGE);
    }
}
