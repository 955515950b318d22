package com.everrich.reconciliation.service;

import java.util.List;

/**
 * Published inside the allocating transaction when a split group reaches its target.
 * Both lists name every record on either side of the group, anchor included.
 */
public record SplitGroupCompletedEvent(String groupId, List<Long> expenseIds, List<Long> movementIds, String actor) {
}
