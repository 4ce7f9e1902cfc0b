package com.nosota.mshop.security;

import com.nosota.mshop.error.ForbiddenException;
import com.nosota.mshop.error.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.function.Supplier;

/**
 * Grants admin routes through {@link AccessControlService#requireAdmin(String)}.
 *
 * <p>Denial is turned into a response by the security chain: 401 when the request carried no
 * usable token (it is still anonymous), 403 when the caller is authenticated but not an admin.
 *
 * <p>Created by {@code SecurityConfig}, not registered as a bean.
 */
@Slf4j
public class AdminAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private final AccessControlService accessControlService;

    public AdminAuthorizationManager(AccessControlService accessControlService) {
        this.accessControlService = accessControlService;
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        String token = JwtAuthenticationFilter.resolveToken(context.getRequest());
        try {
            accessControlService.requireAdmin(token);
            return new AuthorizationDecision(true);
        } catch (UnauthenticatedException | ForbiddenException e) {
            log.debug("Admin route denied for {} {}: {}",
                    context.getRequest().getMethod(), context.getRequest().getRequestURI(), e.getMessage());
            return new AuthorizationDecision(false);
        }
    }
}
