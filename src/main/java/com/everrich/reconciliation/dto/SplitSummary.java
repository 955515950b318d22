package com.everrich.reconciliation.dto;

import java.util.List;
import java.util.Map;

import com.everrich.reconciliation.entities.SplitType;

/**
 * Split activity of one company. Rejected groups are not counted.
 *
 * @param totalAllocated sum of the amounts the counted groups allocate, in minor units
 * @param recent         the five newest groups
 */
public record SplitSummary(
        String companyId,
        int totalGroups,
        int completeGroups,
        int openGroups,
        long totalAllocated,
        Map<SplitType, Long> groupsByType,
        List<SplitResult> recent) {
}
