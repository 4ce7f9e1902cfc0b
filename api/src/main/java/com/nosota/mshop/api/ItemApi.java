package com.nosota.mshop.api;

import com.nosota.mshop.api.dto.ItemDTO;
import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.ItemUpdateRequest;
import com.nosota.mshop.api.response.MessageResponse;
import com.nosota.mshop.api.response.PurchaseResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Catalog API.
 *
 * <p>Listing is public, buying needs any authenticated user, and create/update/delete
 * are restricted to the admin.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>ItemController - in service module (server-side implementation)</li>
 *   <li>ItemClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/items")
public interface ItemApi {

    /**
     * All catalog items, newest first.
     */
    @GetMapping
    ResponseEntity<List<ItemDTO>> listItems() throws Exception;

    /**
     * Adds an item to the catalog. The calling admin's username is stored as its creator.
     */
    @PostMapping
    ResponseEntity<ItemDTO> createItem(@RequestBody @Valid ItemRequest request) throws Exception;

    /**
     * Overwrites the fields present in the request.
     */
    @PutMapping("/{itemId}")
    ResponseEntity<ItemDTO> updateItem(
            @PathVariable("itemId") Long itemId,
            @RequestBody @Valid ItemUpdateRequest request) throws Exception;

    /**
     * Removes an item. Purchases and ledger entries that reference it are kept.
     */
    @DeleteMapping("/{itemId}")
    ResponseEntity<MessageResponse> deleteItem(@PathVariable("itemId") Long itemId) throws Exception;

    /**
     * Buys an item with the calling user's wallet.
     *
     * @param itemId Item to buy
     * @return Confirmation, the new balance and the purchase record
     */
    @PostMapping("/{itemId}/buy")
    ResponseEntity<PurchaseResponse> buyItem(@PathVariable("itemId") Long itemId) throws Exception;
}
