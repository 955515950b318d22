package com.everrich.reconciliation.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import com.everrich.reconciliation.entities.ReconciliationSplit;
import com.everrich.reconciliation.entities.SplitGroup;
import com.everrich.reconciliation.entities.SplitGroupStatus;
import com.everrich.reconciliation.entities.SplitType;

/**
 * State of a split group after an allocation operation.
 */
public class SplitResult {

    private String groupId;
    private SplitType splitType;
    private SplitGroupStatus status;
    private Long anchorId;
    private long targetAmount;
    private long allocatedAmount;
    private long remainingAmount;
    private boolean complete;
    private int revision;
    private LocalDateTime verifiedAt;
    private List<Line> lines;

    public SplitResult() {
    }

    public static SplitResult of(SplitGroup group, List<ReconciliationSplit> rows) {
        SplitResult result = new SplitResult();
        result.groupId = group.getGroupId();
        result.splitType = group.getSplitType();
        result.status = group.getStatus();
        result.anchorId = group.getAnchorId();
        result.targetAmount = group.getTargetAmount();
        result.allocatedAmount = group.getAllocatedAmount();
        result.remainingAmount = group.getRemainingAmount();
        result.complete = group.isComplete();
        result.revision = group.getRevision();
        result.verifiedAt = group.getVerifiedAt();
        result.lines = rows.stream()
                .map(row -> new Line(row.getExpenseId(), row.getMovementId(), row.getAllocatedAmount(), row.getPercentage()))
                .toList();
        return result;
    }

    public String getGroupId() {
        return groupId;
    }

    public SplitType getSplitType() {
        return splitType;
    }

    public SplitGroupStatus getStatus() {
        return status;
    }

    public Long getAnchorId() {
        return anchorId;
    }

    public long getTargetAmount() {
        return targetAmount;
    }

    public long getAllocatedAmount() {
        return allocatedAmount;
    }

    public long getRemainingAmount() {
        return remainingAmount;
    }

    public boolean isComplete() {
        return complete;
    }

    public int getRevision() {
        return revision;
    }

    public LocalDateTime getVerifiedAt() {
        return verifiedAt;
    }

    public List<Line> getLines() {
        return lines;
    }

    public record Line(Long expenseId, Long movementId, long allocatedAmount, BigDecimal percentage) {
    }
}
