package com.everrich.reconciliation.exception;

/**
 * A malformed escalation rule. The sweep logs it and leaves the case unescalated.
 */
public class RuleEvaluationException extends LedgerException {

    private final String ruleCode;

    public RuleEvaluationException(String ruleCode, String message) {
        super("Escalation rule " + ruleCode + ": " + message);
        this.ruleCode = ruleCode;
    }

    public String getRuleCode() {
        return ruleCode;
    }
}
