package com.nosota.mshop.api.response;

/**
 * Response for deposit and withdrawal.
 */
public record WalletOperationResponse(
        String message,
        Long balance
) {}
