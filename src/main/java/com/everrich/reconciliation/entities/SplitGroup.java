package com.everrich.reconciliation.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Header of a split group: the anchor record of the "one" side, the target amount
 * it decomposes and the running allocated total of its member rows.
 */
@Getter
@Setter
@Entity
@Table(name = "SPLIT_GROUP")
@NoArgsConstructor
public class SplitGroup {

    @Id
    @Column(name = "group_id")
    private String groupId;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "split_type", nullable = false)
    private SplitType splitType;

    @Column(name = "anchor_id", nullable = false)
    private Long anchorId;

    @Column(name = "target_amount", nullable = false)
    private long targetAmount;

    @Column(name = "allocated_amount", nullable = false)
    private long allocatedAmount;

    @Column(nullable = false)
    private boolean complete;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SplitGroupStatus status = SplitGroupStatus.OPEN;

    @Column(name = "last_operation_id")
    private String lastOperationId;

    // Incremented on every revision; member operation ids are derived from it
    @Column(nullable = false)
    private int revision;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @Column(name = "verified_by")
    private String verifiedBy;

    // Wrapper type so a new group with an assigned id is persisted rather than merged
    @Version
    private Long version;

    public SplitGroup(String groupId, SplitType splitType, Long anchorId, long targetAmount, String createdBy) {
        this.groupId = groupId;
        this.splitType = splitType;
        this.anchorId = anchorId;
        this.targetAmount = targetAmount;
        this.createdBy = createdBy;
        this.createdAt = LocalDateTime.now();
    }

    public long getRemainingAmount() {
        return targetAmount - allocatedAmount;
    }

    public boolean isOpen() {
        return status == SplitGroupStatus.OPEN;
    }
}
