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
 * A recorded company or employee expenditure awaiting reconciliation.
 */
@Getter
@Setter
@Entity
@Table(name = "EXPENSE_RECORD", indexes = {
    @Index(name = "idx_expense_split_group", columnList = "split_group_id"),
    @Index(name = "idx_expense_advance", columnList = "employee_advance, reimbursement_status")
})
@NoArgsConstructor
public class ExpenseRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "reconciliation_mode", nullable = false)
    private ReconciliationMode reconciliationMode = ReconciliationMode.SIMPLE;

    @Enumerated(EnumType.STRING)
    @Column(name = "bank_status", nullable = false)
    private ExpenseBankStatus bankStatus = ExpenseBankStatus.UNRECONCILED;

    @Column(name = "amount_reconciled", nullable = false)
    private long amountReconciled;

    // Stored copy of amount - amountReconciled, kept current by LedgerStoreService
    @Column(name = "amount_pending", nullable = false)
    private long amountPending;

    @Column(name = "employee_advance", nullable = false)
    private boolean employeeAdvance = false;

    @Column(name = "advance_id")
    private Long advanceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reimbursement_status", nullable = false)
    private ReimbursementStatus reimbursementStatus = ReimbursementStatus.NOT_REQUIRED;

    @Column(name = "split_group_id")
    private String splitGroupId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Version
    private long version;

    public ExpenseRecord(String companyId, String description, long amount, String currency, LocalDate expenseDate) {
        this.companyId = companyId;
        this.description = description;
        this.amount = amount;
        this.currency = currency;
        this.expenseDate = expenseDate;
        this.amountPending = amount;
        this.createdAt = LocalDateTime.now();
    }
}
