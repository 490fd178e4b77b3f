package com.duelo.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One append-only movement of credits. The signed {@code amount} of all entries of a user,
 * in id order, sums to the {@code balanceAfter} of the latest entry.
 */
@Entity
@Immutable
@Table(name = "credit_ledger_entry")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class CreditLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", length = 30, nullable = false, updatable = false)
    private TransactionType transactionType;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "related_entity_type", length = 50, updatable = false)
    private String relatedEntityType;

    @Column(name = "related_entity_id", updatable = false)
    private UUID relatedEntityId;

    @Column(name = "description", columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(name = "model", length = 100, updatable = false)
    private String model;

    @Column(name = "tokens_used", updatable = false)
    private Integer tokensUsed;

    @Column(name = "real_cost_usd", precision = 12, scale = 6, updatable = false)
    private BigDecimal realCostUsd;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
