package com.everrich.reconciliation.service;

import com.everrich.reconciliation.entities.EscalationRule;

/**
 * The rule chosen for a case, or none, and the escalation delay that follows from it.
 */
public record EscalationPlan(EscalationRule rule, int afterDays) {

    public String ruleCode() {
        return rule == null ? null : rule.getRuleCode();
    }
}
