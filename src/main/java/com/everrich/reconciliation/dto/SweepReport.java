package com.everrich.reconciliation.dto;

/**
 * Outcome counters of one escalation sweep.
 */
public record SweepReport(int examined, int escalated, int skipped, int failed) {
}
