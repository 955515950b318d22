package com.everrich.reconciliation.service;

import java.time.LocalDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.reconciliation.entities.EscalationRule;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.exception.NotFoundException;
import com.everrich.reconciliation.repository.EscalationRuleRepository;

@Service
public class EscalationRuleService {

    private static final Logger log = LoggerFactory.getLogger(EscalationRuleService.class);

    private final EscalationRuleRepository ruleRepository;
    private final EscalationRuleEvaluator ruleEvaluator;

    public EscalationRuleService(EscalationRuleRepository ruleRepository, EscalationRuleEvaluator ruleEvaluator) {
        this.ruleRepository = ruleRepository;
        this.ruleEvaluator = ruleEvaluator;
    }

    @Transactional(readOnly = true)
    public List<EscalationRule> listRules(String companyId) {
        return ruleRepository.findByCompanyIdOrderByEvaluationOrderAscIdAsc(companyId);
    }

    @Transactional(readOnly = true)
    public EscalationRule getRule(Long id) {
        return ruleRepository.findById(id).orElseThrow(() -> new NotFoundException("Escalation rule", id));
    }

    @Transactional
    public EscalationRule createRule(EscalationRule rule, String actor) {
        ruleEvaluator.validate(rule);
        if (ruleRepository.findByCompanyIdAndRuleCode(rule.getCompanyId(), rule.getRuleCode()).isPresent()) {
            throw new InvalidStateException("Rule " + rule.getRuleCode() + " already exists for company " + rule.getCompanyId());
        }
        rule.setId(null);
        rule.setCreatedBy(actor);
        rule.setCreatedAt(LocalDateTime.now());
        EscalationRule saved = ruleRepository.save(rule);
        log.info("Escalation rule {} created for company {} by {}: after {} days", saved.getRuleCode(),
                saved.getCompanyId(), actor, saved.getEscalationAfterDays());
        return saved;
    }

    @Transactional
    public EscalationRule updateRule(Long id, EscalationRule changes) {
        ruleEvaluator.validate(changes);
        EscalationRule rule = getRule(id);
        rule.setRuleName(changes.getRuleName());
        rule.setActive(changes.isActive());
        rule.setEvaluationOrder(changes.getEvaluationOrder());
        rule.getReasonCodes().clear();
        if (changes.getReasonCodes() != null) {
            rule.getReasonCodes().addAll(changes.getReasonCodes());
        }
        rule.getCategories().clear();
        if (changes.getCategories() != null) {
            rule.getCategories().addAll(changes.getCategories());
        }
        rule.setMinimumAmount(changes.getMinimumAmount());
        rule.setMaximumAmount(changes.getMaximumAmount());
        rule.setEscalationAfterDays(changes.getEscalationAfterDays());
        rule.setRecipientType(changes.getRecipientType());
        rule.setRecipientIdentifier(changes.getRecipientIdentifier());
        rule.setTemplateId(changes.getTemplateId());
        log.info("Escalation rule {} updated", rule.getRuleCode());
        return ruleRepository.save(rule);
    }

    /**
     * Rules are deactivated rather than deleted so cases keep a resolvable rule code.
     */
    @Transactional
    public EscalationRule deactivateRule(Long id) {
        EscalationRule rule = getRule(id);
        rule.setActive(false);
        log.info("Escalation rule {} deactivated", rule.getRuleCode());
        return ruleRepository.save(rule);
    }
}
