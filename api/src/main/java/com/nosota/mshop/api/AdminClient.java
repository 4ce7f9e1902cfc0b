package com.nosota.mshop.api;

import com.nosota.mshop.api.dto.UserDTO;
import com.nosota.mshop.api.response.StatsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of AdminApi. Needs a WebClient carrying the admin's bearer token.
 */
@RequiredArgsConstructor
@Slf4j
public class AdminClient implements AdminApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<UserDTO>> listUsers() {
        log.debug("Calling listUsers");

        return webClient.get()
                .uri("/api/admin/users")
                .retrieve()
                .toEntityList(UserDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<StatsResponse> getStats() {
        log.debug("Calling getStats");

        return webClient.get()
                .uri("/api/admin/stats")
                .retrieve()
                .toEntity(StatsResponse.class)
                .block();
    }
}
