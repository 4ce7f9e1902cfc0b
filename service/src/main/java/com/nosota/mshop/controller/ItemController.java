package com.nosota.mshop.controller;

import com.nosota.mshop.api.ItemApi;
import com.nosota.mshop.api.dto.ItemDTO;
import com.nosota.mshop.api.request.ItemRequest;
import com.nosota.mshop.api.request.ItemUpdateRequest;
import com.nosota.mshop.api.response.MessageResponse;
import com.nosota.mshop.api.response.PurchaseResponse;
import com.nosota.mshop.dto.PurchaseReceipt;
import com.nosota.mshop.mapper.ItemMapper;
import com.nosota.mshop.mapper.PurchaseMapper;
import com.nosota.mshop.model.Item;
import com.nosota.mshop.security.AuthenticatedUser;
import com.nosota.mshop.security.SecurityUtils;
import com.nosota.mshop.service.CatalogService;
import com.nosota.mshop.service.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the catalog and for buying items.
 *
 * <p>Role checks for the admin operations are enforced by the security filter chain.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ItemController implements ItemApi {

    private final CatalogService catalogService;
    private final WalletLedgerService walletLedgerService;

    @Override
    public ResponseEntity<List<ItemDTO>> listItems() {
        return ResponseEntity.ok(ItemMapper.INSTANCE.toDTOList(catalogService.listItems()));
    }

    @Override
    public ResponseEntity<ItemDTO> createItem(ItemRequest request) throws Exception {
        AuthenticatedUser admin = SecurityUtils.currentUser();
        Item item = catalogService.createItem(request, admin.username());
        return ResponseEntity.status(HttpStatus.CREATED).body(ItemMapper.INSTANCE.toDTO(item));
    }

    @Override
    public ResponseEntity<ItemDTO> updateItem(Long itemId, ItemUpdateRequest request) throws Exception {
        Item item = catalogService.updateItem(itemId, request);
        return ResponseEntity.ok(ItemMapper.INSTANCE.toDTO(item));
    }

    @Override
    public ResponseEntity<MessageResponse> deleteItem(Long itemId) throws Exception {
        catalogService.deleteItem(itemId);
        return ResponseEntity.ok(new MessageResponse("Item deleted successfully"));
    }

    @Override
    public ResponseEntity<PurchaseResponse> buyItem(Long itemId) throws Exception {
        AuthenticatedUser caller = SecurityUtils.currentUser();
        PurchaseReceipt receipt = walletLedgerService.purchase(caller.id(), itemId);
        PurchaseResponse response = new PurchaseResponse(
                "Purchase successful",
                receipt.balance(),
                PurchaseMapper.INSTANCE.toDTO(receipt.purchase())
        );
        return ResponseEntity.ok(response);
    }
}
