package com.nosota.mshop.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Record of an item bought by a user.
 * <p>
 * {@code itemName} and {@code price} are copied from the item when the purchase is made;
 * later edits or deletion of the item do not touch them.
 * </p>
 */
@Entity
@Table(name = "purchase")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Purchase {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "item_name", nullable = false)
    private String itemName;

    @Column(nullable = false)
    private Long price;

    @CreationTimestamp
    @Column(name = "purchase_date", nullable = false, updatable = false)
    private LocalDateTime purchaseDate;
}
