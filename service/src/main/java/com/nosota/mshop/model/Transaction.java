package com.nosota.mshop.model;

import com.nosota.mshop.api.model.TransactionStatus;
import com.nosota.mshop.api.model.TransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Transaction entity - an IMMUTABLE ledger entry for one wallet change.
 *
 * <p>Rows are append-only. The amount is always positive; {@link TransactionType#direction()}
 * gives the sign of the wallet delta it recorded.
 *
 * <p>User and item are referenced by id only, so deleting an item keeps its purchase entries.
 */
@Entity
@Table(name = "ledger_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Transaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionType type;

    @Column(nullable = false)
    private Long amount;

    /**
     * Set for PURCHASE entries only.
     */
    @Column(name = "item_id")
    private Long itemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status;

    @Column(length = 512)
    private String description;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
