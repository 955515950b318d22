package com.everrich.reconciliation.entities;

import java.time.LocalDate;
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
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single transaction reported on a bank statement.
 * Amounts are signed minor currency units: negative for debits, positive for credits.
 */
@Getter
@Setter
@Entity
@Table(name = "BANK_MOVEMENT", indexes = {
    @Index(name = "idx_movement_split_group", columnList = "split_group_id"),
    @Index(name = "idx_movement_company", columnList = "company_id")
})
@NoArgsConstructor
public class BankMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "reconciliation_mode", nullable = false)
    private ReconciliationMode reconciliationMode = ReconciliationMode.SIMPLE;

    @Column(name = "amount_allocated", nullable = false)
    private long amountAllocated;

    // Stored copy of abs(amount) - amountAllocated, kept current by LedgerStoreService
    @Column(name = "amount_unallocated", nullable = false)
    private long amountUnallocated;

    @Column(name = "split_group_id")
    private String splitGroupId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MovementStatus status = MovementStatus.ACTIVE;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Version
    private long version;

    public BankMovement(String companyId, long amount, String currency, LocalDate transactionDate, String description) {
        this.companyId = companyId;
        this.amount = amount;
        this.currency = currency;
        this.transactionDate = transactionDate;
        this.description = description;
        this.amountUnallocated = Math.abs(amount);
        this.createdAt = LocalDateTime.now();
    }

    public long getAbsoluteAmount() {
        return Math.abs(amount);
    }

    public MovementDirection getDirection() {
        return MovementDirection.of(amount);
    }
}
