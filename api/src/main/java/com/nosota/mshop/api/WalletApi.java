package com.nosota.mshop.api;

import com.nosota.mshop.api.request.AmountRequest;
import com.nosota.mshop.api.response.BalanceResponse;
import com.nosota.mshop.api.response.WalletOperationResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Wallet API of the calling user. Requires a bearer token.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WalletController - in service module (server-side implementation)</li>
 *   <li>WalletClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/wallet")
public interface WalletApi {

    /**
     * Current wallet balance.
     */
    @GetMapping("/balance")
    ResponseEntity<BalanceResponse> getBalance() throws Exception;

    /**
     * Adds funds to the wallet and records a deposit entry.
     *
     * @param request Amount, must be positive
     * @return Confirmation message and the new balance
     */
    @PostMapping("/deposit")
    ResponseEntity<WalletOperationResponse> deposit(@RequestBody AmountRequest request) throws Exception;

    /**
     * Takes funds out of the wallet and records a withdrawal entry.
     *
     * @param request Amount, must be positive and not exceed the balance
     * @return Confirmation message and the new balance
     */
    @PostMapping("/withdraw")
    ResponseEntity<WalletOperationResponse> withdraw(@RequestBody AmountRequest request) throws Exception;
}
