package com.nosota.mshop.api.response;

public record MessageResponse(
        String message
) {}
