package com.everrich.reconciliation.entities;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Company-scoped escalation rule. Empty reason/category filters match everything;
 * null amount bounds are open.
 */
@Getter
@Setter
@Entity
@Table(name = "ESCALATION_RULE", uniqueConstraints = {
    @UniqueConstraint(name = "uk_rule_company_code", columnNames = {"company_id", "rule_code"})
})
@NoArgsConstructor
public class EscalationRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "rule_code", nullable = false)
    private String ruleCode;

    @Column(name = "rule_name", nullable = false)
    private String ruleName;

    @Column(nullable = false)
    private boolean active = true;

    // Lower values are evaluated first
    @Column(name = "evaluation_order", nullable = false)
    private int evaluationOrder = 100;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ESCALATION_RULE_REASON", joinColumns = @JoinColumn(name = "rule_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "reason_code")
    private Set<ReasonCode> reasonCodes = EnumSet.noneOf(ReasonCode.class);

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ESCALATION_RULE_CATEGORY", joinColumns = @JoinColumn(name = "rule_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "category")
    private Set<ReasonCategory> categories = EnumSet.noneOf(ReasonCategory.class);

    @Column(name = "minimum_amount")
    private Long minimumAmount;

    @Column(name = "maximum_amount")
    private Long maximumAmount;

    @Column(name = "escalation_after_days", nullable = false)
    private int escalationAfterDays = 7;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type")
    private RecipientType recipientType;

    @Column(name = "recipient_identifier")
    private String recipientIdentifier;

    @Column(name = "template_id")
    private String templateId;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public EscalationRule(String companyId, String ruleCode, String ruleName, int escalationAfterDays) {
        this.companyId = companyId;
        this.ruleCode = ruleCode;
        this.ruleName = ruleName;
        this.escalationAfterDays = escalationAfterDays;
        this.createdAt = LocalDateTime.now();
    }
}
