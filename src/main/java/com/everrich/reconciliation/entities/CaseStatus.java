package com.everrich.reconciliation.entities;

import java.util.EnumSet;
import java.util.Set;

/**
 * Workflow status of a non-reconciliation case.
 */
public enum CaseStatus {
    PENDING,
    IN_PROGRESS,
    ESCALATED,
    RESOLVED,
    DISMISSED,
    ON_HOLD,
    REQUIRES_APPROVAL;

    private static final Set<CaseStatus> TERMINAL = EnumSet.of(RESOLVED, DISMISSED);
    private static final Set<CaseStatus> HOLDS = EnumSet.of(ON_HOLD, REQUIRES_APPROVAL);
    private static final Set<CaseStatus> SWEEPABLE = EnumSet.of(PENDING, IN_PROGRESS);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isHold() {
        return HOLDS.contains(this);
    }

    /**
     * Only cases in these states are promoted by the time-driven sweep.
     */
    public boolean isSweepable() {
        return SWEEPABLE.contains(this);
    }

    public static Set<CaseStatus> sweepable() {
        return EnumSet.copyOf(SWEEPABLE);
    }

    public static Set<CaseStatus> open() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }

    /**
     * Whether a manual or time-driven move from this status to {@code target} is allowed.
     * Releasing a hold is handled separately because it restores the pre-hold status.
     */
    public boolean canTransitionTo(CaseStatus target) {
        if (isTerminal() || target == this) {
            return false;
        }
        switch (target) {
            case ESCALATED:
                return isSweepable();
            case IN_PROGRESS:
                return this == PENDING;
            case RESOLVED:
            case DISMISSED:
            case ON_HOLD:
            case REQUIRES_APPROVAL:
                return true;
            case PENDING:
            default:
                return false;
        }
    }
}
