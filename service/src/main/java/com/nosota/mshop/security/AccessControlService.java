package com.nosota.mshop.security;

import com.nosota.mshop.api.model.UserRole;
import com.nosota.mshop.error.ForbiddenException;
import com.nosota.mshop.error.UnauthenticatedException;
import com.nosota.mshop.model.User;
import com.nosota.mshop.repository.UserRepository;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the caller behind a bearer token.
 *
 * <p>The token only identifies the user. Role and existence are read from the store on
 * every call, so a role change or a removed account takes effect on the next request
 * even for tokens issued earlier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessControlService {

    static final String UNAUTHENTICATED_MESSAGE = "Please authenticate";
    static final String FORBIDDEN_MESSAGE = "Admin access required";

    private final JwtTokenService jwtTokenService;
    private final UserRepository userRepository;

    /**
     * Returns the current user record for the token.
     *
     * @param token Raw token without the {@code Bearer } prefix, may be null
     * @throws UnauthenticatedException if the token is missing or invalid, or its user is gone
     */
    @Transactional(readOnly = true)
    public User authenticate(String token) throws UnauthenticatedException {
        if (token == null || token.isBlank()) {
            throw new UnauthenticatedException(UNAUTHENTICATED_MESSAGE);
        }

        Long userId;
        try {
            userId = jwtTokenService.parseUserId(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new UnauthenticatedException(UNAUTHENTICATED_MESSAGE, e);
        }

        return userRepository.findById(userId)
                .orElseThrow(() -> new UnauthenticatedException(UNAUTHENTICATED_MESSAGE));
    }

    /**
     * Same as {@link #authenticate(String)}, and the stored role must be ADMIN.
     *
     * @throws ForbiddenException if the user is not currently an admin
     */
    @Transactional(readOnly = true)
    public User requireAdmin(String token) throws UnauthenticatedException, ForbiddenException {
        User user = authenticate(token);
        if (user.getRole() != UserRole.ADMIN) {
            log.warn("Admin access denied: userId={}", user.getId());
            throw new ForbiddenException(FORBIDDEN_MESSAGE);
        }
        return user;
    }
}
