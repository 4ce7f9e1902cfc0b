package com.nosota.mshop.api;

import com.nosota.mshop.api.dto.ItemDTO;
import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.ItemUpdateRequest;
import com.nosota.mshop.api.response.MessageResponse;
import com.nosota.mshop.api.response.PurchaseResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of ItemApi.
 *
 * <p>{@link #listItems()} works anonymously; the other calls need a WebClient carrying a
 * bearer token (admin token for create/update/delete).
 */
@RequiredArgsConstructor
@Slf4j
public class ItemClient implements ItemApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<ItemDTO>> listItems() {
        log.debug("Calling listItems");

        return webClient.get()
                .uri("/api/items")
                .retrieve()
                .toEntityList(ItemDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ItemDTO> createItem(ItemRequest request) {
        log.debug("Calling createItem: name={}, price={}", request.name(), request.price());

        return webClient.post()
                .uri("/api/items")
                .bodyValue(request)
                .retrieve()
                .toEntity(ItemDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ItemDTO> updateItem(Long itemId, ItemUpdateRequest request) {
        log.debug("Calling updateItem: itemId={}", itemId);

        return webClient.put()
                .uri("/api/items/{itemId}", itemId)
                .bodyValue(request)
                .retrieve()
                .toEntity(ItemDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<MessageResponse> deleteItem(Long itemId) {
        log.debug("Calling deleteItem: itemId={}", itemId);

        return webClient.delete()
                .uri("/api/items/{itemId}", itemId)
                .retrieve()
                .toEntity(MessageResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PurchaseResponse> buyItem(Long itemId) {
        log.debug("Calling buyItem: itemId={}", itemId);

        return webClient.post()
                .uri("/api/items/{itemId}/buy", itemId)
                .retrieve()
                .toEntity(PurchaseResponse.class)
                .block();
    }
}
