package com.everrich.reconciliation.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.everrich.reconciliation.config.LedgerFixtures;
import com.everrich.reconciliation.config.TestClockConfig;
import com.everrich.reconciliation.dto.LedgerRef;
import com.everrich.reconciliation.dto.SplitMember;
import com.everrich.reconciliation.dto.SplitProposal;
import com.everrich.reconciliation.dto.SplitResult;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.SplitType;

/**
 * Several groups drawing on the same debit movement at once.
 */
@SpringBootTest
@Import({TestClockConfig.class, LedgerFixtures.class})
@ActiveProfiles("test")
class ConcurrentAllocationTest {

    private static final int WRITERS = 4;

    @Autowired
    private AllocationService allocationService;

    @Autowired
    private LedgerStoreService ledgerStore;

    @Autowired
    private LedgerFixtures fixtures;

    @Test
    @DisplayName("concurrent groups on one movement add up without lost updates")
    void concurrentGroupsOnSharedMovement() throws Exception {
        String company = LedgerFixtures.newCompany();
        BankMovement shared = fixtures.debit(company, 100_000);
        List<ExpenseRecord> expenses = new ArrayList<>();
        for (int i = 0; i < WRITERS; i++) {
            expenses.add(fixtures.expense(company, 10_000));
        }

        ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<SplitResult>> results = new ArrayList<>();
        try {
            for (ExpenseRecord expense : expenses) {
                Callable<SplitResult> task = () -> {
                    go.await();
                    return allocationService.proposeSplit(new SplitProposal(LedgerFixtures.newId("grp"),
                            SplitType.MANY_TO_ONE, expense.getId(),
                            List.of(new SplitMember(LedgerRef.movement(shared.getId()), 10_000)),
                            LedgerFixtures.newId("op"), "matcher", null));
                };
                results.add(pool.submit(task));
            }
            go.countDown();
            for (Future<SplitResult> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS).isComplete()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        BankMovement after = ledgerStore.getMovement(shared.getId());
        assertThat(after.getAmountAllocated()).isEqualTo(40_000);
        assertThat(after.getAmountUnallocated()).isEqualTo(60_000);
        for (ExpenseRecord expense : expenses) {
            assertThat(ledgerStore.getExpense(expense.getId()).getAmountPending()).isZero();
        }
    }
}
