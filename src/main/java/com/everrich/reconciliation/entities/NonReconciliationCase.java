package com.everrich.reconciliation.entities;

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
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An open record of why a specific expense or movement could not yet be matched.
 * There is at most one case per (expense, reason) and per (movement, reason).
 */
@Getter
@Setter
@Entity
@Table(name = "NON_RECONCILIATION_CASE",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_case_expense_reason", columnNames = {"expense_id", "reason_code"}),
        @UniqueConstraint(name = "uk_case_movement_reason", columnNames = {"movement_id", "reason_code"})
    },
    indexes = {
        @Index(name = "idx_case_company_status", columnList = "company_id, status"),
        @Index(name = "idx_case_next_escalation", columnList = "next_escalation_date")
    })
@NoArgsConstructor
public class NonReconciliationCase {

    public static final int MIN_ESCALATION_LEVEL = 1;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "expense_id")
    private Long expenseId;

    @Column(name = "movement_id")
    private Long movementId;

    // Amount at stake in minor units, used for rule amount ranges and impact
    @Column(nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason_code", nullable = false)
    private ReasonCode reasonCode;

    @Column(name = "reason_description", columnDefinition = "TEXT")
    private String reasonDescription;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CaseStatus status = CaseStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_before_hold")
    private CaseStatus statusBeforeHold;

    @Column(name = "escalation_level", nullable = false)
    private int escalationLevel = MIN_ESCALATION_LEVEL;

    @Column(name = "next_escalation_date")
    private LocalDateTime nextEscalationDate;

    @Column(name = "escalation_rule_code")
    private String escalationRuleCode;

    @Column(name = "escalated_to")
    private String escalatedTo;

    @Enumerated(EnumType.STRING)
    @Column(name = "business_impact", nullable = false)
    private BusinessImpact businessImpact = BusinessImpact.LOW;

    @Column(name = "resolution_priority", nullable = false)
    private int resolutionPriority = 3;

    @Column(name = "estimated_resolution_date")
    private LocalDateTime estimatedResolutionDate;

    @Column(name = "actual_resolution_date")
    private LocalDateTime actualResolutionDate;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "updated_by")
    private String updatedBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private long version;

    public NonReconciliationCase(String companyId, ReasonCode reasonCode, long amount, String createdBy, LocalDateTime createdAt) {
        this.companyId = companyId;
        this.reasonCode = reasonCode;
        this.amount = amount;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public ReasonCategory getReasonCategory() {
        return reasonCode.getCategory();
    }
}
