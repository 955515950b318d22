package com.everrich.reconciliation.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One (expense, movement) pairing inside a split group.
 */
@Getter
@Setter
@Entity
@Table(name = "RECONCILIATION_SPLIT", indexes = {
    @Index(name = "idx_splits_group", columnList = "split_group_id"),
    @Index(name = "idx_splits_expense", columnList = "expense_id"),
    @Index(name = "idx_splits_movement", columnList = "movement_id")
})
@NoArgsConstructor
public class ReconciliationSplit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "split_group_id", nullable = false)
    private String splitGroupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "split_type", nullable = false)
    private SplitType splitType;

    @Column(name = "expense_id", nullable = false)
    private Long expenseId;

    @Column(name = "movement_id", nullable = false)
    private Long movementId;

    @Column(name = "allocated_amount", nullable = false)
    private long allocatedAmount;

    @Column(precision = 7, scale = 4)
    private BigDecimal percentage;

    @Column(name = "is_complete", nullable = false)
    private boolean complete;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    public ReconciliationSplit(String splitGroupId, SplitType splitType, Long expenseId, Long movementId,
                               long allocatedAmount, BigDecimal percentage, String createdBy) {
        this.splitGroupId = splitGroupId;
        this.splitType = splitType;
        this.expenseId = expenseId;
        this.movementId = movementId;
        this.allocatedAmount = allocatedAmount;
        this.percentage = percentage;
        this.createdBy = createdBy;
        this.createdAt = LocalDateTime.now();
    }
}
