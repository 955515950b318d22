package com.everrich.reconciliation.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Marks a caller-supplied operation id as applied to a ledger record.
 * A second delta carrying the same id is ignored.
 */
@Getter
@Entity
@Table(name = "APPLIED_OPERATION", uniqueConstraints = {
    @UniqueConstraint(name = "uk_applied_operation_id", columnNames = "operation_id")
})
@NoArgsConstructor
public class AppliedOperation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "operation_id", nullable = false)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_kind", nullable = false)
    private LedgerRecordKind recordKind;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(nullable = false)
    private long delta;

    @Column(name = "applied_at", nullable = false)
    private LocalDateTime appliedAt;

    public AppliedOperation(String operationId, LedgerRecordKind recordKind, Long recordId, long delta) {
        this.operationId = operationId;
        this.recordKind = recordKind;
        this.recordId = recordId;
        this.delta = delta;
        this.appliedAt = LocalDateTime.now();
    }
}
