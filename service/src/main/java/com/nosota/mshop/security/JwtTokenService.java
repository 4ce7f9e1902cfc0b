package com.nosota.mshop.security;

import com.nosota.mshop.config.ShopProperties;
import com.nosota.mshop.model.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256 bearer tokens.
 *
 * <p>The subject is the user id. The {@code role} claim is informational only; access
 * decisions always use the role stored in the database.
 */
@Component
@Slf4j
public class JwtTokenService {

    static final String USER_ID_CLAIM = "userId";
    static final String ROLE_CLAIM = "role";

    private final Key key;
    private final Duration tokenValidity;
    private final Clock clock;

    public JwtTokenService(ShopProperties properties, Clock clock) {
        this.key = Keys.hmacShaKeyFor(properties.security().jwtSecret().getBytes(StandardCharsets.UTF_8));
        this.tokenValidity = properties.security().tokenValidity();
        this.clock = clock;
        log.info("JWT token service initialized: validity={}", tokenValidity);
    }

    /**
     * Issues a token for the user, valid for the configured window from now.
     */
    public String issueToken(User user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(user.getId()))
                .claim(USER_ID_CLAIM, user.getId())
                .claim(ROLE_CLAIM, user.getRole().value())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(tokenValidity)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verifies signature and expiry and returns the user id the token was issued for.
     *
     * @throws JwtException             if the token is malformed, expired or badly signed
     * @throws IllegalArgumentException if the token is empty or carries no usable user id
     */
    public Long parseUserId(String token) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token has no subject");
        }
        return Long.valueOf(subject);
    }
}
