package com.everrich.reconciliation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.everrich.reconciliation.config.ReconciliationProperties;
import com.everrich.reconciliation.entities.EscalationRule;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.entities.ReasonCategory;
import com.everrich.reconciliation.entities.ReasonCode;
import com.everrich.reconciliation.entities.RecipientType;
import com.everrich.reconciliation.exception.RuleEvaluationException;
import com.everrich.reconciliation.repository.EscalationRuleRepository;

@ExtendWith(MockitoExtension.class)
class EscalationRuleEvaluatorTest {

    private static final String COMPANY = "co-1";

    @Mock
    private EscalationRuleRepository ruleRepository;

    private EscalationRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new EscalationRuleEvaluator(ruleRepository, new ReconciliationProperties());
    }

    private static NonReconciliationCase caseFor(ReasonCode reason, long amount) {
        return new NonReconciliationCase(COMPANY, reason, amount, "matcher", LocalDateTime.of(2025, 3, 3, 9, 0));
    }

    private static EscalationRule rule(String code, int afterDays) {
        return new EscalationRule(COMPANY, code, code, afterDays);
    }

    private void givenRules(EscalationRule... rules) {
        when(ruleRepository.findByCompanyIdAndActiveTrueOrderByEvaluationOrderAscIdAsc(COMPANY))
                .thenReturn(List.of(rules));
    }

    @Test
    @DisplayName("the first rule whose filters accept the case wins")
    void firstMatchingRuleWins() {
        EscalationRule vendors = rule("VENDORS", 3);
        vendors.setReasonCodes(EnumSet.of(ReasonCode.MISSING_VENDOR));
        EscalationRule bigMissingData = rule("BIG_MISSING_DATA", 2);
        bigMissingData.setCategories(EnumSet.of(ReasonCategory.MISSING_DATA));
        bigMissingData.setMinimumAmount(500_000L);
        EscalationRule missingData = rule("MISSING_DATA", 10);
        missingData.setCategories(EnumSet.of(ReasonCategory.MISSING_DATA));
        givenRules(vendors, bigMissingData, missingData);

        EscalationPlan plan = evaluator.evaluate(caseFor(ReasonCode.MISSING_RECEIPT, 20_000));

        assertThat(plan.ruleCode()).isEqualTo("MISSING_DATA");
        assertThat(plan.afterDays()).isEqualTo(10);
    }

    @Test
    @DisplayName("with no matching rule the configured default delay applies")
    void defaultDelay() {
        EscalationRule vendors = rule("VENDORS", 3);
        vendors.setReasonCodes(EnumSet.of(ReasonCode.MISSING_VENDOR));
        givenRules(vendors);

        EscalationPlan plan = evaluator.evaluate(caseFor(ReasonCode.API_TIMEOUT, 1_000));

        assertThat(plan.rule()).isNull();
        assertThat(plan.ruleCode()).isNull();
        assertThat(plan.afterDays()).isEqualTo(7);
    }

    @Test
    @DisplayName("a malformed rule that accepts the case is reported")
    void malformedMatchingRule() {
        EscalationRule broken = rule("BROKEN", 5);
        broken.setMinimumAmount(10_000L);
        broken.setMaximumAmount(1_000L);
        givenRules(broken);

        assertThatThrownBy(() -> evaluator.evaluate(caseFor(ReasonCode.MISSING_RECEIPT, 5_000)))
                .isInstanceOf(RuleEvaluationException.class)
                .hasMessageContaining("BROKEN");
    }

    @Test
    @DisplayName("a malformed rule for other reasons does not affect the case")
    void malformedRuleForOtherReasons() {
        EscalationRule broken = rule("BROKEN", 0);
        broken.setReasonCodes(EnumSet.of(ReasonCode.DATE_FUTURE));
        givenRules(broken);

        assertThat(evaluator.evaluate(caseFor(ReasonCode.MISSING_RECEIPT, 5_000)).afterDays()).isEqualTo(7);
    }

    @Test
    @DisplayName("validation rejects a recipient type without a recipient")
    void recipientRequired() {
        EscalationRule rule = rule("NO_RECIPIENT", 5);
        rule.setRecipientType(RecipientType.EMAIL);

        assertThatThrownBy(() -> evaluator.validate(rule)).isInstanceOf(RuleEvaluationException.class);
    }

    @Test
    @DisplayName("amount bounds are inclusive")
    void amountBounds() {
        EscalationRule rule = rule("BAND", 5);
        rule.setMinimumAmount(1_000L);
        rule.setMaximumAmount(2_000L);

        assertThat(EscalationRuleEvaluator.matchesAmount(rule, 1_000)).isTrue();
        assertThat(EscalationRuleEvaluator.matchesAmount(rule, 2_000)).isTrue();
        assertThat(EscalationRuleEvaluator.matchesAmount(rule, 2_001)).isFalse();
        assertThat(EscalationRuleEvaluator.matchesAmount(rule, 999)).isFalse();
    }
}
