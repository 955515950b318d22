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
 * An expense paid personally by an employee that the company owes back.
 * Completed advances are kept for audit; only administrative cancellation ends one early.
 */
@Getter
@Setter
@Entity
@Table(name = "EMPLOYEE_ADVANCE", indexes = {
    @Index(name = "idx_advances_employee", columnList = "employee_id"),
    @Index(name = "idx_advances_status", columnList = "status"),
    @Index(name = "idx_advances_expense", columnList = "expense_id", unique = true)
})
@NoArgsConstructor
public class EmployeeAdvance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Column(name = "employee_name", nullable = false)
    private String employeeName;

    @Column(name = "expense_id", nullable = false)
    private Long expenseId;

    @Column(name = "advance_amount", nullable = false)
    private long advanceAmount;

    @Column(name = "reimbursed_amount", nullable = false)
    private long reimbursedAmount;

    @Column(name = "pending_amount", nullable = false)
    private long pendingAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "reimbursement_channel", nullable = false)
    private ReimbursementChannel reimbursementChannel = ReimbursementChannel.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AdvanceStatus status = AdvanceStatus.PENDING;

    @Column(name = "reimbursement_movement_id")
    private Long reimbursementMovementId;

    @Column(name = "advance_date", nullable = false)
    private LocalDate advanceDate;

    @Column(name = "reimbursement_date")
    private LocalDateTime reimbursementDate;

    // e.g. personal card, personal cash
    @Column(name = "payment_method")
    private String paymentMethod;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private long version;

    public EmployeeAdvance(String employeeId, String employeeName, Long expenseId, long advanceAmount, LocalDate advanceDate) {
        this.employeeId = employeeId;
        this.employeeName = employeeName;
        this.expenseId = expenseId;
        this.advanceAmount = advanceAmount;
        this.pendingAmount = advanceAmount;
        this.advanceDate = advanceDate;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    public void appendNote(String note) {
        this.notes = notes == null ? note : notes + "\n" + note;
    }
}
