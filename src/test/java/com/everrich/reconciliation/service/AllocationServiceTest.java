package com.everrich.reconciliation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.everrich.reconciliation.config.LedgerFixtures;
import com.everrich.reconciliation.config.TestClockConfig;
import com.everrich.reconciliation.dto.LedgerRef;
import com.everrich.reconciliation.dto.SplitDecision;
import com.everrich.reconciliation.dto.SplitMember;
import com.everrich.reconciliation.dto.SplitProposal;
import com.everrich.reconciliation.dto.SplitResult;
import com.everrich.reconciliation.dto.SplitSummary;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseBankStatus;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.ReconciliationMode;
import com.everrich.reconciliation.entities.SplitGroupStatus;
import com.everrich.reconciliation.entities.SplitType;
import com.everrich.reconciliation.exception.AllocationOverflowException;
import com.everrich.reconciliation.exception.AlreadyAllocatedException;
import com.everrich.reconciliation.exception.InvalidSplitTypeException;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.exception.NotFoundException;
import com.everrich.reconciliation.repository.AppliedOperationRepository;
import com.everrich.reconciliation.repository.ReconciliationSplitRepository;

@SpringBootTest
@Import({TestClockConfig.class, LedgerFixtures.class})
@ActiveProfiles("test")
class AllocationServiceTest {

    @Autowired
    private AllocationService allocationService;

    @Autowired
    private LedgerStoreService ledgerStore;

    @Autowired
    private LedgerFixtures fixtures;

    @Autowired
    private ReconciliationSplitRepository splitRepository;

    @Autowired
    private AppliedOperationRepository appliedOperationRepository;

    @Autowired
    private TestClockConfig.MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(TestClockConfig.START);
    }

    private SplitProposal proposal(String groupId, SplitType type, Long anchorId, String operationId,
                                   SplitMember... members) {
        return new SplitProposal(groupId, type, anchorId, List.of(members), operationId, "matcher", null);
    }

    @Nested
    @DisplayName("proposeSplit")
    class Propose {

        @Test
        @DisplayName("one expense paid by two movements completes the group")
        void expensePaidByTwoMovements() {
            String company = LedgerFixtures.newCompany();
            ExpenseRecord expense = fixtures.expense(company, 50_000);
            BankMovement m1 = fixtures.debit(company, 30_000);
            BankMovement m2 = fixtures.debit(company, 20_000);
            String groupId = LedgerFixtures.newId("grp");

            SplitResult result = allocationService.proposeSplit(proposal(groupId, SplitType.MANY_TO_ONE, expense.getId(),
                    LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.movement(m1.getId()), 30_000),
                    new SplitMember(LedgerRef.movement(m2.getId()), 20_000)));

            assertThat(result.isComplete()).isTrue();
            assertThat(result.getStatus()).isEqualTo(SplitGroupStatus.COMPLETE);
            assertThat(result.getRemainingAmount()).isZero();
            assertThat(result.getLines()).hasSize(2);

            ExpenseRecord reloaded = ledgerStore.getExpense(expense.getId());
            assertThat(reloaded.getAmountPending()).isZero();
            assertThat(reloaded.getBankStatus()).isEqualTo(ExpenseBankStatus.RECONCILED);
            assertThat(reloaded.getReconciliationMode()).isEqualTo(ReconciliationMode.SPLIT);
            assertThat(reloaded.getSplitGroupId()).isEqualTo(groupId);
            assertThat(ledgerStore.getMovement(m1.getId()).getAmountUnallocated()).isZero();
            assertThat(ledgerStore.getMovement(m2.getId()).getAmountUnallocated()).isZero();
        }

        @Test
        @DisplayName("one movement funding two expenses short of its amount stays open")
        void movementFundingTwoExpenses() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 100_000);
            ExpenseRecord e1 = fixtures.expense(company, 40_000);
            ExpenseRecord e2 = fixtures.expense(company, 40_000);

            SplitResult result = allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.ONE_TO_MANY, movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 40_000),
                    new SplitMember(LedgerRef.expense(e2.getId()), 40_000)));

            assertThat(result.isComplete()).isFalse();
            assertThat(result.getStatus()).isEqualTo(SplitGroupStatus.OPEN);
            assertThat(result.getRemainingAmount()).isEqualTo(20_000);

            BankMovement reloaded = ledgerStore.getMovement(movement.getId());
            assertThat(reloaded.getAmountAllocated()).isEqualTo(80_000);
            assertThat(reloaded.getAmountUnallocated()).isEqualTo(20_000);
            assertThat(ledgerStore.getExpense(e1.getId()).getAmountPending()).isZero();
        }

        @Test
        @DisplayName("replaying an operation id returns the same state without applying twice")
        void replayIsIdempotent() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 10_000);
            ExpenseRecord expense = fixtures.expense(company, 6_000);
            SplitProposal proposal = proposal(LedgerFixtures.newId("grp"), SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(expense.getId()), 6_000));

            SplitResult first = allocationService.proposeSplit(proposal);
            long recordedOps = appliedOperationRepository.count();
            SplitResult second = allocationService.proposeSplit(proposal);

            assertThat(second.getAllocatedAmount()).isEqualTo(first.getAllocatedAmount());
            assertThat(second.getLines()).hasSize(1);
            assertThat(appliedOperationRepository.count()).isEqualTo(recordedOps);
            assertThat(ledgerStore.getMovement(movement.getId()).getAmountAllocated()).isEqualTo(6_000);
            assertThat(ledgerStore.getExpense(expense.getId()).getAmountReconciled()).isEqualTo(6_000);
        }

        @Test
        @DisplayName("a second submission for an existing group with a new operation id is refused")
        void existingGroupNeedsRevision() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 10_000);
            ExpenseRecord expense = fixtures.expense(company, 6_000);
            String groupId = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(expense.getId()), 6_000)));

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY,
                    movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(expense.getId()), 6_000))))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("members summing past the target overflow and change nothing")
        void overflowLeavesNoTrace() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 10_000);
            ExpenseRecord e1 = fixtures.expense(company, 6_000);
            ExpenseRecord e2 = fixtures.expense(company, 6_000);
            String groupId = LedgerFixtures.newId("grp");

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY,
                    movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 6_000),
                    new SplitMember(LedgerRef.expense(e2.getId()), 6_000))))
                    .isInstanceOf(AllocationOverflowException.class);

            assertThat(ledgerStore.getMovement(movement.getId()).getAmountAllocated()).isZero();
            assertThat(ledgerStore.getExpense(e1.getId()).getAmountReconciled()).isZero();
            assertThatThrownBy(() -> allocationService.getSplitGroup(groupId)).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("member amounts whose sum does not fit in a long overflow the target")
        void sumBeyondLongRangeOverflows() {
            String company = LedgerFixtures.newCompany();
            ExpenseRecord anchor = fixtures.expense(company, 10_000);
            BankMovement m1 = fixtures.debit(company, 5_000);
            BankMovement m2 = fixtures.debit(company, 5_000);

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.MANY_TO_ONE, anchor.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.movement(m1.getId()), Long.MAX_VALUE / 2 + 1),
                    new SplitMember(LedgerRef.movement(m2.getId()), Long.MAX_VALUE / 2 + 1))))
                    .isInstanceOf(AllocationOverflowException.class);
            assertThat(ledgerStore.getExpense(anchor.getId()).getAmountReconciled()).isZero();
        }

        @Test
        @DisplayName("an anchor partly used by a closed group targets only what it has left")
        void partlyUsedAnchorTargetsFreeAmount() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 100_000);
            ExpenseRecord e0 = fixtures.expense(company, 30_000);
            ExpenseRecord e1 = fixtures.expense(company, 70_000);
            ExpenseRecord e2 = fixtures.expense(company, 80_000);
            SplitResult first = allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.MANY_TO_ONE, e0.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.movement(movement.getId()), 30_000)));
            assertThat(first.isComplete()).isTrue();

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.ONE_TO_MANY, movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e2.getId()), 80_000))))
                    .isInstanceOfSatisfying(AllocationOverflowException.class,
                            e -> assertThat(e.getTargetAmount()).isEqualTo(70_000));

            String groupId = LedgerFixtures.newId("grp");
            SplitResult second = allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY,
                    movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 70_000)));

            assertThat(second.getTargetAmount()).isEqualTo(70_000);
            assertThat(second.isComplete()).isTrue();
            assertThat(second.getRemainingAmount()).isZero();
            assertThat(ledgerStore.getMovement(movement.getId()).getAmountUnallocated()).isZero();
            assertThat(allocationService.finalizeOrReject(groupId, SplitDecision.FINALIZE, "controller").getVerifiedAt())
                    .isEqualTo(TestClockConfig.START);
        }

        @Test
        @DisplayName("a member failing late in the group rolls back the members applied before it")
        void lateFailureRollsBackEarlierMembers() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 10_000);
            ExpenseRecord e1 = fixtures.expense(company, 3_000);
            ExpenseRecord small = fixtures.expense(company, 1_000);
            String groupId = LedgerFixtures.newId("grp");

            // 2_000 exceeds the second expense's own amount
            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY,
                    movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 3_000),
                    new SplitMember(LedgerRef.expense(small.getId()), 2_000))))
                    .isInstanceOf(InvalidStateException.class);

            ExpenseRecord first = ledgerStore.getExpense(e1.getId());
            assertThat(first.getAmountReconciled()).isZero();
            assertThat(first.getAmountPending()).isEqualTo(3_000);
            assertThat(first.getSplitGroupId()).isNull();
            assertThat(ledgerStore.getMovement(movement.getId()).getAmountUnallocated()).isEqualTo(10_000);
            assertThat(splitRepository.findBySplitGroupIdOrderByIdAsc(groupId)).isEmpty();
        }

        @Test
        @DisplayName("a record held by another open group cannot join")
        void recordInOtherOpenGroup() {
            String company = LedgerFixtures.newCompany();
            BankMovement m1 = fixtures.debit(company, 10_000);
            BankMovement m2 = fixtures.debit(company, 10_000);
            ExpenseRecord expense = fixtures.expense(company, 8_000);
            allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"), SplitType.ONE_TO_MANY, m1.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(expense.getId()), 4_000)));

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.ONE_TO_MANY, m2.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(expense.getId()), 4_000))))
                    .isInstanceOf(AlreadyAllocatedException.class);
            assertThat(ledgerStore.getMovement(m2.getId()).getAmountAllocated()).isZero();
        }

        @Test
        @DisplayName("members on the anchor's side are an invalid split type")
        void membersOnAnchorSide() {
            String company = LedgerFixtures.newCompany();
            BankMovement anchor = fixtures.debit(company, 10_000);
            BankMovement other = fixtures.debit(company, 5_000);

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.ONE_TO_MANY, anchor.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.movement(other.getId()), 5_000))))
                    .isInstanceOf(InvalidSplitTypeException.class);
        }

        @Test
        @DisplayName("mixing expenses and movements as members is an invalid split type")
        void mixedMembers() {
            String company = LedgerFixtures.newCompany();
            ExpenseRecord anchor = fixtures.expense(company, 10_000);
            BankMovement movement = fixtures.debit(company, 5_000);
            ExpenseRecord expense = fixtures.expense(company, 5_000);

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.MANY_TO_ONE, anchor.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.movement(movement.getId()), 5_000),
                    new SplitMember(LedgerRef.expense(expense.getId()), 5_000))))
                    .isInstanceOf(InvalidSplitTypeException.class);
        }

        @Test
        @DisplayName("a credit movement cannot pay an expense")
        void creditMovementRejected() {
            String company = LedgerFixtures.newCompany();
            ExpenseRecord expense = fixtures.expense(company, 5_000);
            BankMovement refund = fixtures.credit(company, 5_000);

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.MANY_TO_ONE, expense.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.movement(refund.getId()), 5_000))))
                    .isInstanceOf(InvalidStateException.class);
            assertThat(ledgerStore.getExpense(expense.getId()).getAmountReconciled()).isZero();
        }

        @Test
        @DisplayName("non-positive member amounts are refused")
        void nonPositiveAmount() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 5_000);
            ExpenseRecord expense = fixtures.expense(company, 5_000);

            assertThatThrownBy(() -> allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"),
                    SplitType.ONE_TO_MANY, movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(expense.getId()), 0))))
                    .isInstanceOf(InvalidStateException.class);
        }
    }

    @Nested
    @DisplayName("revise, finalize and reject")
    class Lifecycle {

        @Test
        @DisplayName("rejecting an open group restores every record exactly")
        void rejectRestores() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 100_000);
            ExpenseRecord e1 = fixtures.expense(company, 40_000);
            ExpenseRecord e2 = fixtures.expense(company, 40_000);
            String groupId = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 40_000),
                    new SplitMember(LedgerRef.expense(e2.getId()), 25_000)));

            SplitResult rejected = allocationService.finalizeOrReject(groupId, SplitDecision.REJECT, "reviewer");

            assertThat(rejected.getStatus()).isEqualTo(SplitGroupStatus.REJECTED);
            assertThat(rejected.getLines()).isEmpty();
            BankMovement m = ledgerStore.getMovement(movement.getId());
            assertThat(m.getAmountAllocated()).isZero();
            assertThat(m.getAmountUnallocated()).isEqualTo(100_000);
            assertThat(m.getSplitGroupId()).isNull();
            assertThat(m.getReconciliationMode()).isEqualTo(ReconciliationMode.SIMPLE);
            for (Long id : List.of(e1.getId(), e2.getId())) {
                ExpenseRecord e = ledgerStore.getExpense(id);
                assertThat(e.getAmountReconciled()).isZero();
                assertThat(e.getAmountPending()).isEqualTo(40_000);
                assertThat(e.getBankStatus()).isEqualTo(ExpenseBankStatus.UNRECONCILED);
                assertThat(e.getSplitGroupId()).isNull();
            }
        }

        @Test
        @DisplayName("a complete group cannot be rejected")
        void completeGroupCannotBeRejected() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 5_000);
            ExpenseRecord expense = fixtures.expense(company, 5_000);
            String groupId = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(expense.getId()), 5_000)));

            assertThatThrownBy(() -> allocationService.finalizeOrReject(groupId, SplitDecision.REJECT, "reviewer"))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("finalize stamps a complete group and refuses an incomplete one")
        void finalizeOnlyComplete() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 5_000);
            ExpenseRecord expense = fixtures.expense(company, 5_000);
            String complete = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(complete, SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(expense.getId()), 5_000)));

            BankMovement other = fixtures.debit(company, 9_000);
            ExpenseRecord partial = fixtures.expense(company, 4_000);
            String incomplete = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(incomplete, SplitType.ONE_TO_MANY, other.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(partial.getId()), 4_000)));

            SplitResult verified = allocationService.finalizeOrReject(complete, SplitDecision.FINALIZE, "controller");
            assertThat(verified.getVerifiedAt()).isEqualTo(TestClockConfig.START);
            assertThatThrownBy(() -> allocationService.finalizeOrReject(incomplete, SplitDecision.FINALIZE, "controller"))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("revising an open group replaces its members and can complete it")
        void reviseCompletes() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 10_000);
            ExpenseRecord e1 = fixtures.expense(company, 6_000);
            ExpenseRecord e2 = fixtures.expense(company, 4_000);
            ExpenseRecord e3 = fixtures.expense(company, 3_000);
            String groupId = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 6_000),
                    new SplitMember(LedgerRef.expense(e3.getId()), 3_000)));

            SplitResult revised = allocationService.reviseSplit(proposal(groupId, SplitType.ONE_TO_MANY,
                    movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 6_000),
                    new SplitMember(LedgerRef.expense(e2.getId()), 4_000)));

            assertThat(revised.isComplete()).isTrue();
            assertThat(revised.getRevision()).isEqualTo(1);
            assertThat(ledgerStore.getExpense(e3.getId()).getAmountReconciled()).isZero();
            assertThat(ledgerStore.getExpense(e3.getId()).getSplitGroupId()).isNull();
            assertThat(ledgerStore.getExpense(e1.getId()).getAmountReconciled()).isEqualTo(6_000);
            assertThat(ledgerStore.getExpense(e2.getId()).getAmountPending()).isZero();
            assertThat(ledgerStore.getMovement(movement.getId()).getAmountUnallocated()).isZero();

            assertThatThrownBy(() -> allocationService.reviseSplit(proposal(groupId, SplitType.ONE_TO_MANY,
                    movement.getId(), LedgerFixtures.newId("op"),
                    new SplitMember(LedgerRef.expense(e1.getId()), 6_000))))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("listing filters by completeness and leaves rejected groups out")
        void listing() {
            String company = LedgerFixtures.newCompany();
            BankMovement movement = fixtures.debit(company, 5_000);
            ExpenseRecord expense = fixtures.expense(company, 2_000);
            String groupId = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(groupId, SplitType.ONE_TO_MANY, movement.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(expense.getId()), 2_000)));

            assertThat(allocationService.listSplitGroups(SplitType.ONE_TO_MANY, false))
                    .extracting(SplitResult::getGroupId).contains(groupId);
            assertThat(allocationService.listSplitGroups(null, true))
                    .extracting(SplitResult::getGroupId).doesNotContain(groupId);

            allocationService.finalizeOrReject(groupId, SplitDecision.REJECT, "reviewer");
            assertThat(allocationService.listSplitGroups(null, null))
                    .extracting(SplitResult::getGroupId).doesNotContain(groupId);
        }

        @Test
        @DisplayName("the summary counts a company's live groups by type and leaves rejected ones out")
        void summary() {
            String company = LedgerFixtures.newCompany();
            ExpenseRecord paid = fixtures.expense(company, 5_000);
            BankMovement payment = fixtures.debit(company, 5_000);
            allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"), SplitType.MANY_TO_ONE, paid.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.movement(payment.getId()), 5_000)));
            BankMovement bulk = fixtures.debit(company, 9_000);
            ExpenseRecord part = fixtures.expense(company, 2_000);
            allocationService.proposeSplit(proposal(LedgerFixtures.newId("grp"), SplitType.ONE_TO_MANY, bulk.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(part.getId()), 2_000)));
            BankMovement other = fixtures.debit(company, 3_000);
            ExpenseRecord dropped = fixtures.expense(company, 1_000);
            String rejected = LedgerFixtures.newId("grp");
            allocationService.proposeSplit(proposal(rejected, SplitType.ONE_TO_MANY, other.getId(),
                    LedgerFixtures.newId("op"), new SplitMember(LedgerRef.expense(dropped.getId()), 1_000)));
            allocationService.finalizeOrReject(rejected, SplitDecision.REJECT, "reviewer");

            SplitSummary summary = allocationService.summarize(company);

            assertThat(summary.totalGroups()).isEqualTo(2);
            assertThat(summary.completeGroups()).isEqualTo(1);
            assertThat(summary.openGroups()).isEqualTo(1);
            assertThat(summary.totalAllocated()).isEqualTo(7_000);
            assertThat(summary.groupsByType()).containsEntry(SplitType.ONE_TO_MANY, 1L)
                    .containsEntry(SplitType.MANY_TO_ONE, 1L);
            assertThat(summary.recent()).extracting(SplitResult::getGroupId).doesNotContain(rejected).hasSize(2);
        }
    }
}
