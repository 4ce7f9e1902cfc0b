package com.nosota.mshop.api;

import com.nosota.mshop.api.dto.PurchaseDTO;
import com.nosota.mshop.api.dto.TransactionDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of UserApi. Needs a WebClient carrying a bearer token.
 */
@RequiredArgsConstructor
@Slf4j
public class UserClient implements UserApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<PurchaseDTO>> getPurchases() {
        log.debug("Calling getPurchases");

        return webClient.get()
                .uri("/api/user/purchases")
                .retrieve()
                .toEntityList(PurchaseDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TransactionDTO>> getTransactions() {
        log.debug("Calling getTransactions");

        return webClient.get()
                .uri("/api/user/transactions")
                .retrieve()
                .toEntityList(TransactionDTO.class)
                .block();
    }
}
