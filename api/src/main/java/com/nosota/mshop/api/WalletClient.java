package com.nosota.mshop.api;

import com.nosota.mshop.api.request.AmountRequest;
import com.nosota.mshop.api.response.BalanceResponse;
import com.nosota.mshop.api.response.WalletOperationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of WalletApi.
 *
 * <p>The supplied WebClient must carry the user's bearer token, see {@link ShopClients#bearer}.
 */
@RequiredArgsConstructor
@Slf4j
public class WalletClient implements WalletApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<BalanceResponse> getBalance() {
        log.debug("Calling getBalance");

        return webClient.get()
                .uri("/api/wallet/balance")
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletOperationResponse> deposit(AmountRequest request) {
        log.debug("Calling deposit: amount={}", request.amount());

        return webClient.post()
                .uri("/api/wallet/deposit")
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletOperationResponse> withdraw(AmountRequest request) {
        log.debug("Calling withdraw: amount={}", request.amount());

        return webClient.post()
                .uri("/api/wallet/withdraw")
                .bodyValue(request)
                .retrieve()
                .toEntity(WalletOperationResponse.class)
                .block();
    }
}
