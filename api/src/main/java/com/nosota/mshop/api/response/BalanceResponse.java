package com.nosota.mshop.api.response;

/**
 * Response for wallet balance query.
 */
public record BalanceResponse(
        Long balance
) {}
