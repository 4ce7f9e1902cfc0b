package com.nosota.mshop.api;

import com.nosota.mshop.api.request.LoginRequest;
import com.nosota.mshop.api.request.RegisterRequest;
import com.nosota.mshop.api.response.AuthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of AuthApi.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MShopClientConfig {
 *     @Bean
 *     public WebClient mshopWebClient(WebClient.Builder builder,
 *                                     @Value("${services.mshop.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public AuthClient authClient(WebClient mshopWebClient) {
 *         return new AuthClient(mshopWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class AuthClient implements AuthApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<AuthResponse> register(RegisterRequest request) {
        log.debug("Calling register: username={}", request.username());

        return webClient.post()
                .uri("/api/auth/register")
                .bodyValue(request)
                .retrieve()
                .toEntity(AuthResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuthResponse> login(LoginRequest request) {
        log.debug("Calling login: username={}", request.username());

        return webClient.post()
                .uri("/api/auth/login")
                .bodyValue(request)
                .retrieve()
                .toEntity(AuthResponse.class)
                .block();
    }
}
