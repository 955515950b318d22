package com.everrich.reconciliation.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.everrich.reconciliation.entities.AdvanceStatus;
import com.everrich.reconciliation.entities.AnalyticsSnapshot;
import com.everrich.reconciliation.entities.BusinessImpact;
import com.everrich.reconciliation.entities.CaseStatus;
import com.everrich.reconciliation.entities.EmployeeAdvance;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.entities.PeriodType;
import com.everrich.reconciliation.entities.ReasonCategory;
import com.everrich.reconciliation.entities.SplitGroup;
import com.everrich.reconciliation.entities.SplitGroupStatus;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.repository.AnalyticsSnapshotRepository;
import com.everrich.reconciliation.repository.EmployeeAdvanceRepository;
import com.everrich.reconciliation.repository.NonReconciliationCaseRepository;
import com.everrich.reconciliation.repository.SplitGroupRepository;
import com.google.gson.Gson;

/**
 * Periodic rollups over cases, split groups and advances.
 *
 * Every figure is recomputed from the ledger tables; nothing is counted incrementally.
 * Case and split figures cover records created inside the period. Advance figures are the
 * company's position at calculation time.
 */
@Service
public class AnalyticsAggregatorService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsAggregatorService.class);

    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400);

    private final AnalyticsSnapshotRepository snapshotRepository;
    private final NonReconciliationCaseRepository caseRepository;
    private final SplitGroupRepository groupRepository;
    private final EmployeeAdvanceRepository advanceRepository;
    private final TransactionTemplate transactionTemplate;
    private final Gson gson;
    private final Clock clock;

    public AnalyticsAggregatorService(AnalyticsSnapshotRepository snapshotRepository,
                                      NonReconciliationCaseRepository caseRepository,
                                      SplitGroupRepository groupRepository,
                                      EmployeeAdvanceRepository advanceRepository,
                                      TransactionTemplate transactionTemplate,
                                      Gson gson,
                                      Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.caseRepository = caseRepository;
        this.groupRepository = groupRepository;
        this.advanceRepository = advanceRepository;
        this.transactionTemplate = transactionTemplate;
        this.gson = gson;
        this.clock = clock;
    }

    /**
     * Recomputes and stores the snapshot for one company and period, replacing any earlier one.
     */
    public AnalyticsSnapshot computeSnapshot(String companyId, PeriodType periodType,
                                             LocalDateTime periodStart, LocalDateTime periodEnd) {
        if (!periodEnd.isAfter(periodStart)) {
            throw new InvalidStateException("Analytics period must end after it starts");
        }
        return transactionTemplate.execute(status -> {
            AnalyticsSnapshot snapshot = snapshotRepository
                    .findByCompanyIdAndPeriodStartAndPeriodEndAndPeriodType(companyId, periodStart, periodEnd, periodType)
                    .orElseGet(() -> new AnalyticsSnapshot(companyId, periodType, periodStart, periodEnd));

            fillCaseFigures(snapshot, caseRepository
                    .findByCompanyIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(companyId, periodStart, periodEnd));
            fillSplitFigures(snapshot, groupRepository
                    .findByCompanyIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(companyId, periodStart, periodEnd));
            fillAdvanceFigures(snapshot, advanceRepository.findByCompanyId(companyId));
            snapshot.setCalculatedAt(LocalDateTime.now(clock));

            AnalyticsSnapshot saved = snapshotRepository.save(snapshot);
            log.info("Analytics {} snapshot for company {} [{} - {}): {} cases, {} split groups",
                    periodType, companyId, periodStart, periodEnd, saved.getTotalCases(), saved.getSplitGroupCount());
            return saved;
        });
    }

    public AnalyticsSnapshot computeSnapshot(String companyId, PeriodType periodType, LocalDate periodStart) {
        LocalDateTime start = periodStart.atStartOfDay();
        return computeSnapshot(companyId, periodType, start, periodEnd(periodType, start));
    }

    public List<AnalyticsSnapshot> listSnapshots(String companyId, PeriodType periodType) {
        return snapshotRepository.findByCompanyIdAndPeriodTypeOrderByPeriodStartDesc(companyId, periodType);
    }

    /**
     * Daily rollup of the previous day for every company that has cases, split groups or advances.
     */
    @Scheduled(cron = "${reconciliation.analytics.cron:0 0 2 * * *}")
    public void computeDailySnapshots() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        Set<String> companies = activeCompanies();
        log.info("Computing daily analytics for {} companies for {}", companies.size(), yesterday);
        for (String companyId : companies) {
            try {
                computeSnapshot(companyId, PeriodType.DAILY, yesterday);
            } catch (RuntimeException e) {
                log.error("Daily analytics failed for company {}", companyId, e);
            }
        }
    }

    Set<String> activeCompanies() {
        Set<String> companies = new TreeSet<>(caseRepository.findDistinctCompanyIds());
        companies.addAll(groupRepository.findDistinctCompanyIds());
        companies.addAll(advanceRepository.findDistinctCompanyIds());
        return companies;
    }

    static LocalDateTime periodEnd(PeriodType periodType, LocalDateTime start) {
        switch (periodType) {
            case WEEKLY:
                return start.plusWeeks(1);
            case MONTHLY:
                return start.plusMonths(1);
            case DAILY:
            default:
                return start.plusDays(1);
        }
    }

    private void fillCaseFigures(AnalyticsSnapshot snapshot, List<NonReconciliationCase> cases) {
        Map<CaseStatus, Long> byStatus = new EnumMap<>(CaseStatus.class);
        Map<ReasonCategory, Long> byCategory = new EnumMap<>(ReasonCategory.class);
        Map<Integer, Long> byLevel = new TreeMap<>();
        Map<BusinessImpact, Long> byImpact = new EnumMap<>(BusinessImpact.class);
        long everEscalated = 0;
        long openAmount = 0;
        long resolvedWithinEstimate = 0;
        List<BigDecimal> resolutionDays = new ArrayList<>();

        for (NonReconciliationCase nrCase : cases) {
            byStatus.merge(nrCase.getStatus(), 1L, Long::sum);
            byCategory.merge(nrCase.getReasonCategory(), 1L, Long::sum);
            byLevel.merge(nrCase.getEscalationLevel(), 1L, Long::sum);
            byImpact.merge(nrCase.getBusinessImpact(), 1L, Long::sum);
            if (nrCase.getEscalationLevel() > NonReconciliationCase.MIN_ESCALATION_LEVEL) {
                everEscalated++;
            }
            if (!nrCase.getStatus().isTerminal()) {
                openAmount += nrCase.getAmount();
            }
            if (nrCase.getStatus() == CaseStatus.RESOLVED && nrCase.getActualResolutionDate() != null) {
                long seconds = Duration.between(nrCase.getCreatedAt(), nrCase.getActualResolutionDate()).getSeconds();
                resolutionDays.add(BigDecimal.valueOf(seconds).divide(SECONDS_PER_DAY, 2, RoundingMode.HALF_UP));
                if (nrCase.getEstimatedResolutionDate() == null
                        || !nrCase.getActualResolutionDate().isAfter(nrCase.getEstimatedResolutionDate())) {
                    resolvedWithinEstimate++;
                }
            }
        }

        long total = cases.size();
        snapshot.setTotalCases(total);
        snapshot.setPendingCases(byStatus.getOrDefault(CaseStatus.PENDING, 0L));
        snapshot.setInProgressCases(byStatus.getOrDefault(CaseStatus.IN_PROGRESS, 0L));
        snapshot.setEscalatedCases(byStatus.getOrDefault(CaseStatus.ESCALATED, 0L));
        snapshot.setResolvedCases(byStatus.getOrDefault(CaseStatus.RESOLVED, 0L));
        snapshot.setDismissedCases(byStatus.getOrDefault(CaseStatus.DISMISSED, 0L));
        snapshot.setOnHoldCases(byStatus.getOrDefault(CaseStatus.ON_HOLD, 0L)
                + byStatus.getOrDefault(CaseStatus.REQUIRES_APPROVAL, 0L));
        snapshot.setEscalationRate(ratio(everEscalated, total));
        snapshot.setAvgResolutionDays(average(resolutionDays));
        snapshot.setMedianResolutionDays(median(resolutionDays));
        snapshot.setSlaComplianceRate(ratio(resolvedWithinEstimate, resolutionDays.size()));
        snapshot.setByCategory(gson.toJson(byCategory));
        snapshot.setByEscalationLevel(gson.toJson(byLevel));
        snapshot.setByBusinessImpact(gson.toJson(byImpact));
        snapshot.setOpenCaseAmount(openAmount);
    }

    private void fillSplitFigures(AnalyticsSnapshot snapshot, List<SplitGroup> groups) {
        long count = 0;
        long complete = 0;
        long target = 0;
        long allocated = 0;
        for (SplitGroup group : groups) {
            if (group.getStatus() == SplitGroupStatus.REJECTED) {
                continue;
            }
            count++;
            if (group.isComplete()) {
                complete++;
            }
            target += group.getTargetAmount();
            allocated += group.getAllocatedAmount();
        }
        snapshot.setSplitGroupCount(count);
        snapshot.setCompleteSplitGroupCount(complete);
        snapshot.setSplitTargetTotal(target);
        snapshot.setSplitAllocatedTotal(allocated);
        snapshot.setAllocationCompletenessRate(ratio(allocated, target));
    }

    private void fillAdvanceFigures(AnalyticsSnapshot snapshot, List<EmployeeAdvance> advances) {
        long open = 0;
        long pending = 0;
        long completed = 0;
        for (EmployeeAdvance advance : advances) {
            if (advance.getStatus().isOpen()) {
                open++;
                pending += advance.getPendingAmount();
            } else if (advance.getStatus() == AdvanceStatus.COMPLETED) {
                completed++;
            }
        }
        snapshot.setOpenAdvanceCount(open);
        snapshot.setAdvancePendingAmount(pending);
        snapshot.setCompletedAdvanceCount(completed);
    }

    private static BigDecimal ratio(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part).divide(BigDecimal.valueOf(whole), 4, RoundingMode.HALF_UP);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal median(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<BigDecimal> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return sorted.get(mid - 1).add(sorted.get(mid)).divide(BigDecimal.valueOf(2), 2, RoundingMode.HALF_UP);
    }
}
