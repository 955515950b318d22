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
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Periodic rollup recomputed from the ledger tables. Breakdown columns hold Gson encoded
 * maps keyed by enum name.
 */
@Getter
@Setter
@Entity
@Table(name = "ANALYTICS_SNAPSHOT", uniqueConstraints = {
    @UniqueConstraint(name = "uk_snapshot_period", columnNames = {"company_id", "period_start", "period_end", "period_type"})
})
@NoArgsConstructor
public class AnalyticsSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "period_start", nullable = false)
    private LocalDateTime periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDateTime periodEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false)
    private PeriodType periodType;

    private long totalCases;
    private long pendingCases;
    private long inProgressCases;
    private long escalatedCases;
    private long resolvedCases;
    private long dismissedCases;
    private long onHoldCases;

    @Column(precision = 7, scale = 4)
    private BigDecimal escalationRate;

    @Column(precision = 9, scale = 2)
    private BigDecimal avgResolutionDays;

    @Column(precision = 9, scale = 2)
    private BigDecimal medianResolutionDays;

    @Column(precision = 7, scale = 4)
    private BigDecimal slaComplianceRate;

    @Column(name = "by_category", columnDefinition = "TEXT")
    private String byCategory;

    @Column(name = "by_escalation_level", columnDefinition = "TEXT")
    private String byEscalationLevel;

    @Column(name = "by_business_impact", columnDefinition = "TEXT")
    private String byBusinessImpact;

    private long openCaseAmount;

    private long splitGroupCount;
    private long completeSplitGroupCount;
    private long splitTargetTotal;
    private long splitAllocatedTotal;

    @Column(precision = 7, scale = 4)
    private BigDecimal allocationCompletenessRate;

    private long openAdvanceCount;
    private long advancePendingAmount;
    private long completedAdvanceCount;

    @Column(name = "calculated_at", nullable = false)
    private LocalDateTime calculatedAt;

    public AnalyticsSnapshot(String companyId, PeriodType periodType, LocalDateTime periodStart, LocalDateTime periodEnd) {
        this.companyId = companyId;
        this.periodType = periodType;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
    }
}
