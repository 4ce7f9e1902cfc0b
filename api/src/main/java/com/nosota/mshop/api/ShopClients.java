package com.nosota.mshop.api;

import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Helpers for building clients of the mshop service.
 *
 * <p>Authenticated APIs ({@link WalletClient}, {@link UserClient}, {@link AdminClient} and the
 * admin/buy calls of {@link ItemClient}) expect a {@link WebClient} that already sends the
 * bearer token:
 * <pre>
 * {@code
 * AuthResponse session = new AuthClient(webClient).login(new LoginRequest("alice", "secret")).getBody();
 * WalletClient wallet = new WalletClient(ShopClients.bearer(webClient, session.token()));
 * }
 * </pre>
 */
public final class ShopClients {

    private ShopClients() {
    }

    /**
     * Copies {@code webClient} and adds {@code Authorization: Bearer <token>} to every request.
     */
    public static WebClient bearer(WebClient webClient, String token) {
        return webClient.mutate()
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .build();
    }
}
