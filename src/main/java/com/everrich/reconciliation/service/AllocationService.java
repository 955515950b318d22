package com.everrich.reconciliation.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.everrich.reconciliation.config.ReconciliationProperties;
import com.everrich.reconciliation.dto.LedgerRef;
import com.everrich.reconciliation.dto.SplitDecision;
import com.everrich.reconciliation.dto.SplitMember;
import com.everrich.reconciliation.dto.SplitProposal;
import com.everrich.reconciliation.dto.SplitResult;
import com.everrich.reconciliation.dto.SplitSummary;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseBankStatus;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.LedgerRecordKind;
import com.everrich.reconciliation.entities.MovementDirection;
import com.everrich.reconciliation.entities.ReconciliationSplit;
import com.everrich.reconciliation.entities.SplitGroup;
import com.everrich.reconciliation.entities.SplitGroupStatus;
import com.everrich.reconciliation.entities.SplitType;
import com.everrich.reconciliation.exception.AllocationOverflowException;
import com.everrich.reconciliation.exception.AlreadyAllocatedException;
import com.everrich.reconciliation.exception.ConcurrencyConflictException;
import com.everrich.reconciliation.exception.ConflictingReconciliationModeException;
import com.everrich.reconciliation.exception.InvalidSplitTypeException;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.exception.NotFoundException;
import com.everrich.reconciliation.repository.ReconciliationSplitRepository;
import com.everrich.reconciliation.repository.SplitGroupRepository;

/**
 * Creates, revises and closes split groups.
 *
 * A group is applied as one database transaction: the member rows, every member's running
 * total, the anchor's running total and the group header commit together. Optimistic version
 * conflicts rerun the whole operation with freshly read records (see {@link #executeWithRetry}).
 */
@Service
public class AllocationService {

    private static final Logger log = LoggerFactory.getLogger(AllocationService.class);

    private static final int RECENT_GROUPS = 5;

    private final SplitGroupRepository groupRepository;
    private final ReconciliationSplitRepository splitRepository;
    private final LedgerStoreService ledgerStore;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public AllocationService(SplitGroupRepository groupRepository,
                             ReconciliationSplitRepository splitRepository,
                             LedgerStoreService ledgerStore,
                             TransactionTemplate transactionTemplate,
                             ApplicationEventPublisher eventPublisher,
                             ReconciliationProperties properties,
                             Clock clock) {
        this.groupRepository = groupRepository;
        this.splitRepository = splitRepository;
        this.ledgerStore = ledgerStore;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates and commits a new split group.
     * Replaying the same operation id returns the group as it stands.
     */
    public SplitResult proposeSplit(SplitProposal proposal) {
        return executeWithRetry("proposeSplit " + proposal.groupId(), () -> applyProposal(proposal));
    }

    /**
     * Replaces the members of an open group. Current allocations are released and the new
     * members are validated and applied from scratch in the same transaction.
     */
    public SplitResult reviseSplit(SplitProposal proposal) {
        return executeWithRetry("reviseSplit " + proposal.groupId(), () -> applyRevision(proposal));
    }

    public SplitResult finalizeOrReject(String groupId, SplitDecision decision, String actor) {
        return executeWithRetry(decision + " " + groupId, () -> {
            SplitGroup group = loadGroup(groupId);
            return decision == SplitDecision.FINALIZE ? finalizeGroup(group, actor) : rejectGroup(group, actor);
        });
    }

    /**
     * Consumes part of a debit movement for an employee reimbursement. Joins the caller's transaction.
     */
    @Transactional
    public BankMovement allocateReimbursement(Long movementId, long amount, String operationId) {
        if (amount <= 0) {
            throw new InvalidStateException("Reimbursement allocation must be positive");
        }
        BankMovement movement = ledgerStore.getMovement(movementId);
        if (movement.getSplitGroupId() != null) {
            SplitGroup other = groupRepository.findById(movement.getSplitGroupId()).orElse(null);
            if (other != null && other.isOpen()) {
                throw new AlreadyAllocatedException(LedgerRecordKind.MOVEMENT, movementId, other.getGroupId());
            }
        }
        BankMovement updated = ledgerStore.updateMovementAllocation(movementId, amount, operationId, MovementDirection.DEBIT);
        log.info("Allocated {} of movement {} to a reimbursement (op {})", amount, movementId, operationId);
        return updated;
    }

    @Transactional(readOnly = true)
    public SplitResult getSplitGroup(String groupId) {
        return toResult(loadGroup(groupId));
    }

    /**
     * Lists groups, newest first. Rejected groups are left out; null filters match everything.
     */
    @Transactional(readOnly = true)
    public List<SplitResult> listSplitGroups(SplitType splitType, Boolean complete) {
        return groupRepository.findFiltered(splitType, complete, SplitGroupStatus.REJECTED).stream()
                .map(this::toResult)
                .toList();
    }

    /**
     * Counts, totals and the newest groups of one company. Rejected groups are left out.
     */
    @Transactional(readOnly = true)
    public SplitSummary summarize(String companyId) {
        List<SplitGroup> groups = groupRepository.findByCompanyIdAndStatusNotOrderByCreatedAtDesc(companyId,
                SplitGroupStatus.REJECTED);
        int complete = (int) groups.stream().filter(SplitGroup::isComplete).count();
        long allocated = groups.stream().mapToLong(SplitGroup::getAllocatedAmount).sum();
        Map<SplitType, Long> byType = new EnumMap<>(SplitType.class);
        for (SplitType type : SplitType.values()) {
            byType.put(type, 0L);
        }
        groups.forEach(group -> byType.merge(group.getSplitType(), 1L, Long::sum));
        List<SplitResult> recent = groups.stream().limit(RECENT_GROUPS).map(this::toResult).toList();
        return new SplitSummary(companyId, groups.size(), complete, groups.size() - complete, allocated, byType, recent);
    }

    /**
     * Runs {@code work} in a fresh transaction, repeating it while it fails on an optimistic
     * version conflict, up to the configured number of attempts. Validation failures are not retried.
     */
    public <T> T executeWithRetry(String operation, Supplier<T> work) {
        int maxAttempts = Math.max(1, properties.getAllocation().getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            ConcurrencyConflictException conflict;
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyConflictException e) {
                conflict = e;
            } catch (ConcurrencyFailureException e) {
                conflict = new ConcurrencyConflictException("Concurrent update during " + operation, e);
            }
            if (attempt >= maxAttempts) {
                log.warn("{} gave up after {} attempts: {}", operation, attempt, conflict.getMessage());
                throw conflict;
            }
            log.debug("{} hit a version conflict on attempt {}/{}, retrying", operation, attempt, maxAttempts);
            backoff(conflict);
        }
    }

    private SplitResult applyProposal(SplitProposal proposal) {
        validateShape(proposal);
        Optional<SplitGroup> existing = groupRepository.findById(proposal.groupId());
        if (existing.isPresent()) {
            SplitGroup group = existing.get();
            if (proposal.operationId().equals(group.getLastOperationId())) {
                log.info("Replay of operation {} on split group {}, returning current state",
                        proposal.operationId(), group.getGroupId());
                return toResult(group);
            }
            throw new InvalidStateException("Split group " + group.getGroupId() + " already exists; revise it instead");
        }

        Anchor anchor = loadAnchor(proposal.splitType(), proposal.anchorId());
        ensureNotInOtherOpenGroup(anchor.kind(), anchor.id(), anchor.splitGroupId(), proposal.groupId());
        long requested = requestedTotal(proposal, anchor.freeAmount());
        if (requested > anchor.freeAmount()) {
            throw new AllocationOverflowException(proposal.groupId(), anchor.freeAmount(), requested);
        }

        SplitGroup group = new SplitGroup(proposal.groupId(), proposal.splitType(), anchor.id(), anchor.freeAmount(),
                proposal.actor());
        group.setCompanyId(anchor.companyId());
        group.setCreatedAt(LocalDateTime.now(clock));
        group.setNotes(proposal.notes());
        try {
            group = groupRepository.saveAndFlush(group);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Split group " + proposal.groupId() + " created concurrently", e);
        }

        applyMembers(group, proposal);
        log.info("Split group {} ({}) created by {}: {} of {} allocated across {} members",
                group.getGroupId(), group.getSplitType(), proposal.actor(), group.getAllocatedAmount(),
                group.getTargetAmount(), proposal.members().size());
        return toResult(group);
    }

    private SplitResult applyRevision(SplitProposal proposal) {
        validateShape(proposal);
        SplitGroup group = loadGroup(proposal.groupId());
        if (proposal.operationId().equals(group.getLastOperationId())) {
            log.info("Replay of operation {} on split group {}, returning current state",
                    proposal.operationId(), group.getGroupId());
            return toResult(group);
        }
        if (!group.isOpen()) {
            throw new InvalidStateException("Split group " + group.getGroupId() + " is " + group.getStatus()
                    + " and can no longer be revised");
        }
        if (group.getSplitType() != proposal.splitType() || !group.getAnchorId().equals(proposal.anchorId())) {
            throw new InvalidSplitTypeException("A revision must keep the split type and anchor of group "
                    + group.getGroupId());
        }
        long requested = requestedTotal(proposal, group.getTargetAmount());
        if (requested > group.getTargetAmount()) {
            throw new AllocationOverflowException(group.getGroupId(), group.getTargetAmount(), requested);
        }

        releaseMembers(group);
        group.setRevision(group.getRevision() + 1);
        if (proposal.notes() != null) {
            group.setNotes(proposal.notes());
        }
        applyMembers(group, proposal);
        log.info("Split group {} revised to revision {} by {}: {} of {} allocated",
                group.getGroupId(), group.getRevision(), proposal.actor(), group.getAllocatedAmount(),
                group.getTargetAmount());
        return toResult(group);
    }

    private SplitResult finalizeGroup(SplitGroup group, String actor) {
        if (group.getStatus() != SplitGroupStatus.COMPLETE) {
            throw new InvalidStateException("Split group " + group.getGroupId() + " is " + group.getStatus()
                    + "; only complete groups can be finalized (" + group.getRemainingAmount() + " unallocated)");
        }
        if (group.getVerifiedAt() != null) {
            return toResult(group);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        group.setVerifiedAt(now);
        group.setVerifiedBy(actor);
        List<ReconciliationSplit> rows = splitRepository.findBySplitGroupIdOrderByIdAsc(group.getGroupId());
        rows.forEach(row -> row.setVerifiedAt(now));
        splitRepository.saveAll(rows);
        groupRepository.saveAndFlush(group);
        log.info("Split group {} verified by {}", group.getGroupId(), actor);
        return SplitResult.of(group, rows);
    }

    private SplitResult rejectGroup(SplitGroup group, String actor) {
        if (group.getStatus() == SplitGroupStatus.REJECTED) {
            return toResult(group);
        }
        if (!group.isOpen()) {
            throw new InvalidStateException("Split group " + group.getGroupId() + " is complete and cannot be rejected");
        }
        releaseMembers(group);
        group.setStatus(SplitGroupStatus.REJECTED);
        group.setComplete(false);
        groupRepository.saveAndFlush(group);
        log.info("Split group {} rejected by {}, all allocations restored", group.getGroupId(), actor);
        return toResult(group);
    }

    private void applyMembers(SplitGroup group, SplitProposal proposal) {
        SplitType type = group.getSplitType();
        String prefix = group.getGroupId() + "#" + group.getRevision() + "/apply/";
        List<Long> expenseIds = new ArrayList<>();
        List<Long> movementIds = new ArrayList<>();
        long total = 0;

        for (SplitMember member : proposal.members()) {
            Long memberId = member.ref().id();
            Long expenseId;
            Long movementId;
            if (type == SplitType.ONE_TO_MANY) {
                ExpenseRecord expense = ledgerStore.getExpense(memberId);
                ensureSameCompany(group, expense.getCompanyId(), member.ref());
                ensureNotInOtherOpenGroup(LedgerRecordKind.EXPENSE, memberId, expense.getSplitGroupId(), group.getGroupId());
                ledgerStore.updateExpenseReconciliation(memberId, member.amount(), prefix + member.ref());
                ledgerStore.assignExpenseGroup(memberId, group.getGroupId());
                expenseId = memberId;
                movementId = group.getAnchorId();
            } else {
                BankMovement movement = ledgerStore.getMovement(memberId);
                ensureSameCompany(group, movement.getCompanyId(), member.ref());
                ensureNotInOtherOpenGroup(LedgerRecordKind.MOVEMENT, memberId, movement.getSplitGroupId(), group.getGroupId());
                ledgerStore.updateMovementAllocation(memberId, member.amount(), prefix + member.ref(), MovementDirection.DEBIT);
                ledgerStore.assignMovementGroup(memberId, group.getGroupId());
                expenseId = group.getAnchorId();
                movementId = memberId;
            }
            expenseIds.add(expenseId);
            movementIds.add(movementId);
            total += member.amount();
            ReconciliationSplit row = new ReconciliationSplit(group.getGroupId(), type, expenseId, movementId,
                    member.amount(), member.percentage(), proposal.actor());
            row.setNotes(proposal.notes());
            splitRepository.save(row);
        }

        String anchorOp = prefix + "anchor";
        if (type == SplitType.ONE_TO_MANY) {
            ledgerStore.updateMovementAllocation(group.getAnchorId(), total, anchorOp, MovementDirection.DEBIT);
            ledgerStore.assignMovementGroup(group.getAnchorId(), group.getGroupId());
        } else {
            ledgerStore.updateExpenseReconciliation(group.getAnchorId(), total, anchorOp);
            ledgerStore.assignExpenseGroup(group.getAnchorId(), group.getGroupId());
        }

        boolean complete = total == group.getTargetAmount();
        group.setAllocatedAmount(total);
        group.setComplete(complete);
        group.setStatus(complete ? SplitGroupStatus.COMPLETE : SplitGroupStatus.OPEN);
        group.setLastOperationId(proposal.operationId());
        groupRepository.saveAndFlush(group);

        if (complete) {
            List<ReconciliationSplit> rows = splitRepository.findBySplitGroupIdOrderByIdAsc(group.getGroupId());
            rows.forEach(row -> row.setComplete(true));
            splitRepository.saveAll(rows);
            eventPublisher.publishEvent(new SplitGroupCompletedEvent(group.getGroupId(), expenseIds, movementIds,
                    proposal.actor()));
        }
    }

    /**
     * Reverses every allocation the group currently holds and deletes its rows.
     */
    private void releaseMembers(SplitGroup group) {
        String prefix = group.getGroupId() + "#" + group.getRevision() + "/release/";
        List<ReconciliationSplit> rows = splitRepository.findBySplitGroupIdOrderByIdAsc(group.getGroupId());
        long total = 0;
        for (ReconciliationSplit row : rows) {
            if (group.getSplitType() == SplitType.ONE_TO_MANY) {
                ledgerStore.updateExpenseReconciliation(row.getExpenseId(), -row.getAllocatedAmount(),
                        prefix + LedgerRef.expense(row.getExpenseId()));
                ledgerStore.assignExpenseGroup(row.getExpenseId(),
                        previousGroup(LedgerRecordKind.EXPENSE, row.getExpenseId(), group.getGroupId()));
            } else {
                ledgerStore.updateMovementAllocation(row.getMovementId(), -row.getAllocatedAmount(),
                        prefix + LedgerRef.movement(row.getMovementId()), null);
                ledgerStore.assignMovementGroup(row.getMovementId(),
                        previousGroup(LedgerRecordKind.MOVEMENT, row.getMovementId(), group.getGroupId()));
            }
            total += row.getAllocatedAmount();
        }

        String anchorOp = prefix + "anchor";
        if (group.getSplitType() == SplitType.ONE_TO_MANY) {
            ledgerStore.updateMovementAllocation(group.getAnchorId(), -total, anchorOp, null);
            ledgerStore.assignMovementGroup(group.getAnchorId(),
                    previousGroup(LedgerRecordKind.MOVEMENT, group.getAnchorId(), group.getGroupId()));
        } else {
            ledgerStore.updateExpenseReconciliation(group.getAnchorId(), -total, anchorOp);
            ledgerStore.assignExpenseGroup(group.getAnchorId(),
                    previousGroup(LedgerRecordKind.EXPENSE, group.getAnchorId(), group.getGroupId()));
        }

        splitRepository.deleteAll(rows);
        splitRepository.flush();
        group.setAllocatedAmount(0);
        group.setComplete(false);
        log.debug("Released {} from split group {} ({} rows)", total, group.getGroupId(), rows.size());
    }

    // A record may still belong to an earlier complete group once this one lets go of it
    private String previousGroup(LedgerRecordKind kind, Long id, String releasingGroupId) {
        List<ReconciliationSplit> others = kind == LedgerRecordKind.EXPENSE
                ? splitRepository.findByExpenseIdAndSplitGroupIdNotOrderByIdDesc(id, releasingGroupId)
                : splitRepository.findByMovementIdAndSplitGroupIdNotOrderByIdDesc(id, releasingGroupId);
        return others.isEmpty() ? null : others.get(0).getSplitGroupId();
    }

    private void validateShape(SplitProposal proposal) {
        if (proposal.groupId() == null || proposal.groupId().isBlank()) {
            throw new InvalidStateException("A split group id is required");
        }
        if (proposal.operationId() == null || proposal.operationId().isBlank()) {
            throw new InvalidStateException("An operation id is required");
        }
        if (proposal.splitType() == null || proposal.anchorId() == null) {
            throw new InvalidStateException("Split type and anchor are required");
        }
        if (proposal.members() == null || proposal.members().isEmpty()) {
            throw new InvalidStateException("A split needs at least one member");
        }

        LedgerRecordKind expected = proposal.splitType().memberKind();
        Set<LedgerRecordKind> kinds = new HashSet<>();
        Set<LedgerRef> seen = new HashSet<>();
        for (SplitMember member : proposal.members()) {
            if (member.ref() == null || member.ref().kind() == null || member.ref().id() == null) {
                throw new InvalidStateException("Every split member needs a record reference");
            }
            kinds.add(member.ref().kind());
            if (member.amount() <= 0) {
                throw new InvalidStateException("Member " + member.ref() + " has non-positive amount " + member.amount());
            }
            if (!seen.add(member.ref())) {
                throw new InvalidStateException("Member " + member.ref() + " appears more than once");
            }
        }
        if (kinds.size() > 1) {
            throw new InvalidSplitTypeException("Split group " + proposal.groupId()
                    + " mixes expenses and movements as members");
        }
        if (!kinds.contains(expected)) {
            throw new InvalidSplitTypeException(proposal.splitType() + " anchors a " + proposal.splitType().anchorKind()
                    + " and takes " + expected + " members, not " + kinds.iterator().next());
        }
    }

    // A sum past Long.MAX_VALUE overflows any target
    private long requestedTotal(SplitProposal proposal, long targetAmount) {
        try {
            return proposal.totalAmount();
        } catch (ArithmeticException e) {
            throw new AllocationOverflowException(proposal.groupId(), targetAmount, Long.MAX_VALUE);
        }
    }

    /**
     * Loads the "one" side of a new group. The group's target is what the anchor still has free,
     * so an anchor already partly used by a closed group or a reimbursement completes on what is left.
     */
    private Anchor loadAnchor(SplitType type, Long anchorId) {
        if (type == SplitType.ONE_TO_MANY) {
            BankMovement movement = ledgerStore.getMovement(anchorId);
            if (movement.getDirection() != MovementDirection.DEBIT) {
                throw new InvalidStateException("Bank movement " + anchorId + " is a credit and cannot fund expenses");
            }
            return new Anchor(LedgerRecordKind.MOVEMENT, anchorId, movement.getCompanyId(),
                    movement.getAmountUnallocated(), movement.getSplitGroupId());
        }
        ExpenseRecord expense = ledgerStore.getExpense(anchorId);
        if (expense.getBankStatus() == ExpenseBankStatus.NON_RECONCILABLE) {
            throw new ConflictingReconciliationModeException("Expense " + anchorId
                    + " awaits advance reimbursement and cannot be matched against the bank");
        }
        return new Anchor(LedgerRecordKind.EXPENSE, anchorId, expense.getCompanyId(), expense.getAmountPending(),
                expense.getSplitGroupId());
    }

    private void ensureNotInOtherOpenGroup(LedgerRecordKind kind, Long id, String currentGroupId, String groupId) {
        if (currentGroupId == null || currentGroupId.equals(groupId)) {
            return;
        }
        groupRepository.findById(currentGroupId)
                .filter(SplitGroup::isOpen)
                .ifPresent(other -> {
                    log.warn("{} {} is held by open split group {}", kind, id, other.getGroupId());
                    throw new AlreadyAllocatedException(kind, id, other.getGroupId());
                });
    }

    private void ensureSameCompany(SplitGroup group, String companyId, LedgerRef ref) {
        if (!group.getCompanyId().equals(companyId)) {
            throw new InvalidStateException(ref + " belongs to another company than split group " + group.getGroupId());
        }
    }

    private SplitGroup loadGroup(String groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new NotFoundException("Split group", groupId));
    }

    private SplitResult toResult(SplitGroup group) {
        return SplitResult.of(group, splitRepository.findBySplitGroupIdOrderByIdAsc(group.getGroupId()));
    }

    private void backoff(ConcurrencyConflictException conflict) {
        long millis = properties.getAllocation().getRetryBackoffMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw conflict;
        }
    }

    private record Anchor(LedgerRecordKind kind, Long id, String companyId, long freeAmount, String splitGroupId) {
    }
}
