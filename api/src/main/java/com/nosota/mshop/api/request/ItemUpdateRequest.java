package com.nosota.mshop.api.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Changes to a catalog item. Fields left {@code null} keep their current value.
 */
public record ItemUpdateRequest(
        @Size(max = 255, message = "Name must be at most 255 characters")
        String name,

        @Size(max = 255, message = "Icon must be at most 255 characters")
        String icon,

        @Size(max = 2000, message = "Description must be at most 2000 characters")
        String description,

        @Positive(message = "Price must be positive")
        Long price
) {
}
