package com.everrich.reconciliation.exception;

public class AllocationOverflowException extends LedgerException {

    private final long targetAmount;
    private final long requestedAmount;

    public AllocationOverflowException(String groupId, long targetAmount, long requestedAmount) {
        super("Split group " + groupId + " would allocate " + requestedAmount + " against a target of " + targetAmount);
        this.targetAmount = targetAmount;
        this.requestedAmount = requestedAmount;
    }

    public long getTargetAmount() {
        return targetAmount;
    }

    public long getRequestedAmount() {
        return requestedAmount;
    }
}
