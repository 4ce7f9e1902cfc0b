package com.nosota.mshop.model;

import com.nosota.mshop.api.model.UserRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * An account together with its wallet.
 * <p>
 * The wallet balance is owned by the account and must only be changed through
 * {@code WalletLedgerService}, which writes the matching ledger entry in the same
 * database transaction.
 * </p>
 * <p>
 * Username and email are unique (constraints in migration V1.00).
 * </p>
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String username;

    @Column(nullable = false, unique = true)
    private String email;

    /**
     * BCrypt hash of the password. Never leaves the service.
     */
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UserRole role;

    /**
     * Spendable balance in whole units. Not constrained at rest.
     */
    @Column(nullable = false)
    private Long wallet;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
