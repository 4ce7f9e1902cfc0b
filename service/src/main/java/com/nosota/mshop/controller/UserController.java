package com.nosota.mshop.controller;

import com.nosota.mshop.api.UserApi;
import com.nosota.mshop.api.dto.PurchaseDTO;
import com.nosota.mshop.api.dto.TransactionDTO;
import com.nosota.mshop.mapper.PurchaseMapper;
import com.nosota.mshop.mapper.TransactionMapper;
import com.nosota.mshop.security.AuthenticatedUser;
import com.nosota.mshop.security.SecurityUtils;
import com.nosota.mshop.service.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class UserController implements UserApi {

    private final WalletLedgerService walletLedgerService;

    @Override
    public ResponseEntity<List<PurchaseDTO>> getPurchases() throws Exception {
        AuthenticatedUser caller = SecurityUtils.currentUser();
        return ResponseEntity.ok(PurchaseMapper.INSTANCE.toDTOList(walletLedgerService.listPurchases(caller.id())));
    }

    @Override
    public ResponseEntity<List<TransactionDTO>> getTransactions() throws Exception {
        AuthenticatedUser caller = SecurityUtils.currentUser();
        return ResponseEntity.ok(TransactionMapper.INSTANCE.toDTOList(walletLedgerService.listTransactions(caller.id())));
    }
}
