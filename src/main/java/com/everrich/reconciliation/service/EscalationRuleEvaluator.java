package com.everrich.reconciliation.service;

import java.util.List;

import org.springframework.stereotype.Component;

import com.everrich.reconciliation.config.ReconciliationProperties;
import com.everrich.reconciliation.entities.EscalationRule;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.entities.ReasonCode;
import com.everrich.reconciliation.exception.RuleEvaluationException;
import com.everrich.reconciliation.repository.EscalationRuleRepository;

/**
 * Picks the escalation rule for a case: the first active rule of the case's company,
 * by evaluation order, whose reason, category and amount filters all accept the case.
 */
@Component
public class EscalationRuleEvaluator {

    private final EscalationRuleRepository ruleRepository;
    private final ReconciliationProperties properties;

    public EscalationRuleEvaluator(EscalationRuleRepository ruleRepository, ReconciliationProperties properties) {
        this.ruleRepository = ruleRepository;
        this.properties = properties;
    }

    /**
     * @throws RuleEvaluationException when the rule that accepts the case is malformed
     */
    public EscalationPlan evaluate(NonReconciliationCase nrCase) {
        List<EscalationRule> rules = ruleRepository.findByCompanyIdAndActiveTrueOrderByEvaluationOrderAscIdAsc(
                nrCase.getCompanyId());
        for (EscalationRule rule : rules) {
            if (!matchesReason(rule, nrCase.getReasonCode())) {
                continue;
            }
            validate(rule);
            if (matchesAmount(rule, nrCase.getAmount())) {
                return new EscalationPlan(rule, rule.getEscalationAfterDays());
            }
        }
        return new EscalationPlan(null, properties.getEscalation().getDefaultAfterDays());
    }

    public void validate(EscalationRule rule) {
        if (rule.getEscalationAfterDays() <= 0) {
            throw new RuleEvaluationException(rule.getRuleCode(),
                    "escalation after " + rule.getEscalationAfterDays() + " days is not positive");
        }
        if (rule.getMinimumAmount() != null && rule.getMaximumAmount() != null
                && rule.getMinimumAmount() > rule.getMaximumAmount()) {
            throw new RuleEvaluationException(rule.getRuleCode(),
                    "minimum amount " + rule.getMinimumAmount() + " exceeds maximum " + rule.getMaximumAmount());
        }
        if (rule.getRecipientType() != null && (rule.getRecipientIdentifier() == null || rule.getRecipientIdentifier().isBlank())) {
            throw new RuleEvaluationException(rule.getRuleCode(), "recipient type without recipient");
        }
    }

    static boolean matchesReason(EscalationRule rule, ReasonCode reasonCode) {
        boolean codeOk = rule.getReasonCodes() == null || rule.getReasonCodes().isEmpty()
                || rule.getReasonCodes().contains(reasonCode);
        boolean categoryOk = rule.getCategories() == null || rule.getCategories().isEmpty()
                || rule.getCategories().contains(reasonCode.getCategory());
        return codeOk && categoryOk;
    }

    static boolean matchesAmount(EscalationRule rule, long amount) {
        if (rule.getMinimumAmount() != null && amount < rule.getMinimumAmount()) {
            return false;
        }
        return rule.getMaximumAmount() == null || amount <= rule.getMaximumAmount();
    }
}
