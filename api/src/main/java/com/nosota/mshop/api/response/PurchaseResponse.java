package com.nosota.mshop.api.response;

import com.nosota.mshop.api.dto.PurchaseDTO;

public record PurchaseResponse(
        String message,
        Long balance,
        PurchaseDTO purchase
) {}
