package com.nosota.mshop.api.response;

import com.nosota.mshop.api.dto.UserDTO;

/**
 * Result of registration or login.
 *
 * @param token Bearer token to send as {@code Authorization: Bearer <token>}
 * @param user  Public view of the account
 */
public record AuthResponse(
        String token,
        UserDTO user
) {}
