package com.nosota.mshop.dto;

import com.nosota.mshop.model.Purchase;

/**
 * Outcome of a successful purchase.
 *
 * @param balance  Wallet balance after the debit
 * @param purchase The stored purchase record
 */
public record PurchaseReceipt(
        Long balance,
        Purchase purchase
) {}
