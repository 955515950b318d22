package com.everrich.reconciliation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.everrich.reconciliation.config.LedgerFixtures;
import com.everrich.reconciliation.config.TestClockConfig;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseBankStatus;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.MovementDirection;
import com.everrich.reconciliation.entities.ReconciliationMode;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.repository.AppliedOperationRepository;

@SpringBootTest
@Import({TestClockConfig.class, LedgerFixtures.class})
@ActiveProfiles("test")
class LedgerStoreServiceTest {

    @Autowired
    private LedgerStoreService ledgerStore;

    @Autowired
    private LedgerFixtures fixtures;

    @Autowired
    private AppliedOperationRepository appliedOperationRepository;

    @Test
    @DisplayName("the same movement delta sent twice under one operation id is applied once")
    void movementDeltaReplay() {
        BankMovement movement = fixtures.debit(LedgerFixtures.newCompany(), 10_000);
        String operationId = LedgerFixtures.newId("op");

        ledgerStore.updateMovementAllocation(movement.getId(), 4_000, operationId, MovementDirection.DEBIT);
        long recordedOps = appliedOperationRepository.count();
        BankMovement replayed = ledgerStore.updateMovementAllocation(movement.getId(), 4_000, operationId,
                MovementDirection.DEBIT);

        assertThat(replayed.getAmountAllocated()).isEqualTo(4_000);
        assertThat(appliedOperationRepository.count()).isEqualTo(recordedOps);
        BankMovement reloaded = ledgerStore.getMovement(movement.getId());
        assertThat(reloaded.getAmountAllocated()).isEqualTo(4_000);
        assertThat(reloaded.getAmountUnallocated()).isEqualTo(6_000);
        assertThat(reloaded.getReconciliationMode()).isEqualTo(ReconciliationMode.PARTIAL);
    }

    @Test
    @DisplayName("the same expense delta sent twice under one operation id is applied once")
    void expenseDeltaReplay() {
        ExpenseRecord expense = fixtures.expense(LedgerFixtures.newCompany(), 8_000);
        String operationId = LedgerFixtures.newId("op");

        ledgerStore.updateExpenseReconciliation(expense.getId(), 8_000, operationId);
        ExpenseRecord replayed = ledgerStore.updateExpenseReconciliation(expense.getId(), 8_000, operationId);

        assertThat(replayed.getAmountReconciled()).isEqualTo(8_000);
        ExpenseRecord reloaded = ledgerStore.getExpense(expense.getId());
        assertThat(reloaded.getAmountReconciled()).isEqualTo(8_000);
        assertThat(reloaded.getAmountPending()).isZero();
        assertThat(reloaded.getBankStatus()).isEqualTo(ExpenseBankStatus.RECONCILED);
    }

    @Test
    @DisplayName("a delta taking a movement past its amount or below zero is refused")
    void deltaOutOfRange() {
        BankMovement movement = fixtures.debit(LedgerFixtures.newCompany(), 5_000);

        assertThatThrownBy(() -> ledgerStore.updateMovementAllocation(movement.getId(), 6_000,
                LedgerFixtures.newId("op"), MovementDirection.DEBIT))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> ledgerStore.updateMovementAllocation(movement.getId(), -1,
                LedgerFixtures.newId("op"), null))
                .isInstanceOf(InvalidStateException.class);
        assertThat(ledgerStore.getMovement(movement.getId()).getAmountAllocated()).isZero();
    }

    @Test
    @DisplayName("a ledger update without an operation id is refused")
    void operationIdRequired() {
        ExpenseRecord expense = fixtures.expense(LedgerFixtures.newCompany(), 1_000);

        assertThatThrownBy(() -> ledgerStore.updateExpenseReconciliation(expense.getId(), 500, " "))
                .isInstanceOf(InvalidStateException.class);
    }
}
