package com.nosota.mshop.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A completed purchase. Item name and price are the values at purchase time.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class PurchaseDTO {
    private Long id;
    private Long userId;
    private Long itemId;
    private String itemName;
    private Long price;
    private LocalDateTime purchaseDate;
}
