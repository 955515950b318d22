package com.everrich.reconciliation.dto;

import java.util.List;

import com.everrich.reconciliation.entities.SplitType;

/**
 * A candidate allocation submitted by the matching pipeline or an operator.
 *
 * @param groupId     caller-chosen opaque group id
 * @param splitType   ONE_TO_MANY anchors a movement, MANY_TO_ONE anchors an expense
 * @param anchorId    id of the single record on the "one" side
 * @param members     records on the other side with the amount each takes
 * @param operationId idempotency key of this submission
 * @param actor       who proposed it
 */
public record SplitProposal(
        String groupId,
        SplitType splitType,
        Long anchorId,
        List<SplitMember> members,
        String operationId,
        String actor,
        String notes) {

    public SplitProposal withActor(String newActor) {
        return new SplitProposal(groupId, splitType, anchorId, members, operationId, newActor, notes);
    }

    /**
     * @throws ArithmeticException when the member amounts do not fit in a long
     */
    public long totalAmount() {
        return members == null ? 0 : members.stream().mapToLong(SplitMember::amount).reduce(0L, Math::addExact);
    }
}
