package com.nosota.mshop.controller;

import com.nosota.mshop.api.WalletApi;
import com.nosota.mshop.api.request.AmountRequest;
import com.nosota.mshop.api.response.BalanceResponse;
import com.nosota.mshop.api.response.WalletOperationResponse;
import com.nosota.mshop.security.AuthenticatedUser;
import com.nosota.mshop.security.SecurityUtils;
import com.nosota.mshop.service.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's own wallet.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletController implements WalletApi {

    private final WalletLedgerService walletLedgerService;

    @Override
    public ResponseEntity<BalanceResponse> getBalance() throws Exception {
        AuthenticatedUser caller = SecurityUtils.currentUser();
        return ResponseEntity.ok(new BalanceResponse(walletLedgerService.getBalance(caller.id())));
    }

    @Override
    public ResponseEntity<WalletOperationResponse> deposit(AmountRequest request) throws Exception {
        AuthenticatedUser caller = SecurityUtils.currentUser();
        Long balance = walletLedgerService.deposit(caller.id(), amountOf(request));
        return ResponseEntity.ok(new WalletOperationResponse("Deposit successful", balance));
    }

    @Override
    public ResponseEntity<WalletOperationResponse> withdraw(AmountRequest request) throws Exception {
        AuthenticatedUser caller = SecurityUtils.currentUser();
        Long balance = walletLedgerService.withdraw(caller.id(), amountOf(request));
        return ResponseEntity.ok(new WalletOperationResponse("Withdrawal successful", balance));
    }

    private static Long amountOf(AmountRequest request) {
        return request != null ? request.amount() : null;
    }
}
