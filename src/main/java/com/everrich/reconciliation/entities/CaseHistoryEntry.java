package com.everrich.reconciliation.entities;

import java.time.LocalDateTime;

import org.hibernate.annotations.Immutable;

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

/**
 * Append-only audit entry for a non-reconciliation case. Rows are never updated or deleted.
 */
@Getter
@Entity
@Immutable
@Table(name = "CASE_HISTORY", indexes = {
    @Index(name = "idx_case_history_case", columnList = "case_id, performed_at")
})
@NoArgsConstructor
public class CaseHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "case_id", nullable = false)
    private Long caseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false)
    private CaseActionType actionType;

    @Column(name = "action_description", columnDefinition = "TEXT")
    private String actionDescription;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status")
    private CaseStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status")
    private CaseStatus newStatus;

    @Column(name = "performed_by", nullable = false)
    private String performedBy;

    @Column(name = "performed_at", nullable = false)
    private LocalDateTime performedAt;

    @Column(name = "system_generated", nullable = false)
    private boolean systemGenerated;

    @Column(name = "correlation_id")
    private String correlationId;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public CaseHistoryEntry(Long caseId, CaseActionType actionType, String actionDescription,
                            CaseStatus previousStatus, CaseStatus newStatus, String performedBy,
                            LocalDateTime performedAt, boolean systemGenerated, String correlationId, String notes) {
        this.caseId = caseId;
        this.actionType = actionType;
        this.actionDescription = actionDescription;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.performedBy = performedBy;
        this.performedAt = performedAt;
        this.systemGenerated = systemGenerated;
        this.correlationId = correlationId;
        this.notes = notes;
    }
}
