package com.nosota.mshop.api;

import com.nosota.mshop.api.dto.PurchaseDTO;
import com.nosota.mshop.api.dto.TransactionDTO;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

/**
 * History of the calling user.
 */
@RequestMapping("/api/user")
public interface UserApi {

    /**
     * All purchases of the caller, newest first.
     */
    @GetMapping("/purchases")
    ResponseEntity<List<PurchaseDTO>> getPurchases() throws Exception;

    /**
     * The caller's 50 most recent ledger entries, newest first.
     */
    @GetMapping("/transactions")
    ResponseEntity<List<TransactionDTO>> getTransactions() throws Exception;
}
