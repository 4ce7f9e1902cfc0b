package com.nosota.mshop.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Application settings under the {@code mshop} prefix. Validated at startup.
 *
 * @param security Token signing settings
 * @param admin    Bootstrap admin account
 * @param cors     Browser origins allowed to call the API
 */
@ConfigurationProperties(prefix = "mshop")
@Validated
public record ShopProperties(
        @Valid @DefaultValue Security security,
        @Valid @DefaultValue Admin admin,
        @Valid @DefaultValue Cors cors
) {

    /**
     * @param jwtSecret     HMAC key for tokens; HS256 needs at least 32 bytes
     * @param tokenValidity Lifetime of an issued token
     */
    public record Security(
            @NotBlank(message = "mshop.security.jwt-secret must be set (JWT_SECRET)")
            @Size(min = 32, message = "mshop.security.jwt-secret must be at least 32 characters")
            String jwtSecret,

            @NotNull
            @DefaultValue("7d")
            Duration tokenValidity
    ) {}

    /**
     * The admin is only created when both username and password are configured.
     */
    public record Admin(
            String username,
            String password,

            @NotBlank
            @DefaultValue("admin@ahadxtoolkit.com")
            String email,

            @NotBlank
            @DefaultValue("Global Admin")
            String name,

            @PositiveOrZero
            @DefaultValue("999999")
            long wallet
    ) {}

    public record Cors(
            @DefaultValue({"http://127.0.0.1:5500", "http://localhost:5500"})
            List<String> allowedOrigins
    ) {}
}
