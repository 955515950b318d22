package com.everrich.reconciliation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import com.everrich.reconciliation.config.LedgerFixtures;
import com.everrich.reconciliation.config.TestClockConfig;
import com.everrich.reconciliation.dto.AdvanceRequest;
import com.everrich.reconciliation.dto.CaseRequest;
import com.everrich.reconciliation.dto.LedgerRef;
import com.everrich.reconciliation.dto.SplitMember;
import com.everrich.reconciliation.dto.SplitProposal;
import com.everrich.reconciliation.entities.AnalyticsSnapshot;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.entities.PeriodType;
import com.everrich.reconciliation.entities.ReasonCode;
import com.everrich.reconciliation.entities.SplitType;
import com.everrich.reconciliation.exception.InvalidStateException;

@SpringBootTest
@Import({TestClockConfig.class, LedgerFixtures.class})
@ActiveProfiles("test")
class AnalyticsAggregatorServiceTest {

    private static final LocalDateTime START = TestClockConfig.START;

    @Autowired
    private AnalyticsAggregatorService analyticsService;

    @Autowired
    private EscalationService escalationService;

    @Autowired
    private AllocationService allocationService;

    @Autowired
    private AdvanceLedgerService advanceService;

    @Autowired
    private LedgerFixtures fixtures;

    @Autowired
    private TestClockConfig.MutableClock clock;

    @BeforeEach
    void resetClock() {
        clock.set(START);
    }

    private NonReconciliationCase openCase(String company, long amount) {
        ExpenseRecord expense = fixtures.expense(company, amount);
        return escalationService.openCase(new CaseRequest(company, expense.getId(), null, amount,
                ReasonCode.MISSING_VENDOR, null, null, null, "matcher"));
    }

    @Test
    @DisplayName("a monthly snapshot gathers cases, splits and advances of one company")
    void monthlySnapshot() {
        String company = LedgerFixtures.newCompany();
        NonReconciliationCase resolved = openCase(company, 1_000);
        NonReconciliationCase dismissed = openCase(company, 2_000);
        openCase(company, 4_000);

        ExpenseRecord paid = fixtures.expense(company, 5_000);
        BankMovement payment = fixtures.debit(company, 5_000);
        allocationService.proposeSplit(new SplitProposal(LedgerFixtures.newId("grp"), SplitType.MANY_TO_ONE,
                paid.getId(), List.of(new SplitMember(LedgerRef.movement(payment.getId()), 5_000)),
                LedgerFixtures.newId("op"), "matcher", null));
        BankMovement bulk = fixtures.debit(company, 10_000);
        ExpenseRecord part = fixtures.expense(company, 3_000);
        allocationService.proposeSplit(new SplitProposal(LedgerFixtures.newId("grp"), SplitType.ONE_TO_MANY,
                bulk.getId(), List.of(new SplitMember(LedgerRef.expense(part.getId()), 3_000)),
                LedgerFixtures.newId("op"), "matcher", null));

        ExpenseRecord outOfPocket = fixtures.expense(company, 4_000);
        advanceService.createAdvance(new AdvanceRequest(outOfPocket.getId(), LedgerFixtures.newId("emp"),
                "Eva Soler", null, null, null, null));

        clock.set(START.plusDays(2));
        escalationService.resolve(resolved.getId(), "analyst", "vendor added");
        escalationService.dismiss(dismissed.getId(), "analyst", "not an issue");

        AnalyticsSnapshot snapshot = analyticsService.computeSnapshot(company, PeriodType.MONTHLY,
                LocalDate.of(2025, 3, 1));

        assertThat(snapshot.getPeriodStart()).isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0));
        assertThat(snapshot.getPeriodEnd()).isEqualTo(LocalDateTime.of(2025, 4, 1, 0, 0));
        assertThat(snapshot.getTotalCases()).isEqualTo(3);
        assertThat(snapshot.getResolvedCases()).isEqualTo(1);
        assertThat(snapshot.getDismissedCases()).isEqualTo(1);
        assertThat(snapshot.getPendingCases()).isEqualTo(1);
        assertThat(snapshot.getOpenCaseAmount()).isEqualTo(4_000);
        assertThat(snapshot.getEscalationRate()).isEqualByComparingTo("0");
        assertThat(snapshot.getAvgResolutionDays()).isEqualByComparingTo("2");
        assertThat(snapshot.getMedianResolutionDays()).isEqualByComparingTo("2");
        assertThat(snapshot.getSlaComplianceRate()).isEqualByComparingTo("1");
        assertThat(snapshot.getByCategory()).contains("\"MISSING_DATA\":3");

        assertThat(snapshot.getSplitGroupCount()).isEqualTo(2);
        assertThat(snapshot.getCompleteSplitGroupCount()).isEqualTo(1);
        assertThat(snapshot.getSplitTargetTotal()).isEqualTo(15_000);
        assertThat(snapshot.getSplitAllocatedTotal()).isEqualTo(8_000);
        assertThat(snapshot.getAllocationCompletenessRate()).isEqualByComparingTo("0.5333");

        assertThat(snapshot.getOpenAdvanceCount()).isEqualTo(1);
        assertThat(snapshot.getAdvancePendingAmount()).isEqualTo(4_000);
        assertThat(snapshot.getCalculatedAt()).isEqualTo(START.plusDays(2));
    }

    @Test
    @DisplayName("recomputing a period replaces its snapshot")
    void recomputeReplaces() {
        String company = LedgerFixtures.newCompany();
        openCase(company, 1_000);
        analyticsService.computeSnapshot(company, PeriodType.DAILY, START.toLocalDate());
        openCase(company, 2_000);

        AnalyticsSnapshot again = analyticsService.computeSnapshot(company, PeriodType.DAILY, START.toLocalDate());

        assertThat(again.getTotalCases()).isEqualTo(2);
        assertThat(analyticsService.listSnapshots(company, PeriodType.DAILY)).hasSize(1);
    }

    @Test
    @DisplayName("cases outside the period are not counted")
    void periodBoundaries() {
        String company = LedgerFixtures.newCompany();
        openCase(company, 1_000);

        AnalyticsSnapshot nextDay = analyticsService.computeSnapshot(company, PeriodType.DAILY,
                START.toLocalDate().plusDays(1));

        assertThat(nextDay.getTotalCases()).isZero();
        assertThat(nextDay.getAvgResolutionDays()).isNull();
    }

    @Test
    @DisplayName("the daily job covers companies with only split groups or only advances")
    void dailyJobCoversEveryActiveCompany() {
        String splitsOnly = LedgerFixtures.newCompany();
        BankMovement movement = fixtures.debit(splitsOnly, 6_000);
        ExpenseRecord expense = fixtures.expense(splitsOnly, 6_000);
        allocationService.proposeSplit(new SplitProposal(LedgerFixtures.newId("grp"), SplitType.ONE_TO_MANY,
                movement.getId(), List.of(new SplitMember(LedgerRef.expense(expense.getId()), 6_000)),
                LedgerFixtures.newId("op"), "matcher", null));
        String advancesOnly = LedgerFixtures.newCompany();
        ExpenseRecord outOfPocket = fixtures.expense(advancesOnly, 2_500);
        advanceService.createAdvance(new AdvanceRequest(outOfPocket.getId(), LedgerFixtures.newId("emp"),
                "Noa Berg", null, null, null, null));

        clock.set(START.plusDays(1));
        analyticsService.computeDailySnapshots();

        List<AnalyticsSnapshot> splitSnapshots = analyticsService.listSnapshots(splitsOnly, PeriodType.DAILY);
        assertThat(splitSnapshots).hasSize(1);
        assertThat(splitSnapshots.get(0).getPeriodStart()).isEqualTo(START.toLocalDate().atStartOfDay());
        assertThat(splitSnapshots.get(0).getSplitGroupCount()).isEqualTo(1);
        assertThat(splitSnapshots.get(0).getTotalCases()).isZero();

        List<AnalyticsSnapshot> advanceSnapshots = analyticsService.listSnapshots(advancesOnly, PeriodType.DAILY);
        assertThat(advanceSnapshots).hasSize(1);
        assertThat(advanceSnapshots.get(0).getAdvancePendingAmount()).isEqualTo(2_500);
    }

    @Test
    @DisplayName("a period must end after it starts")
    void invalidPeriod() {
        assertThatThrownBy(() -> analyticsService.computeSnapshot("co-x", PeriodType.DAILY, START, START))
                .isInstanceOf(InvalidStateException.class);
    }
}
