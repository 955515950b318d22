package com.everrich.reconciliation.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.reconciliation.dto.AdvanceAging;
import com.everrich.reconciliation.dto.AdvanceRequest;
import com.everrich.reconciliation.dto.AdvanceSummary;
import com.everrich.reconciliation.dto.ReimbursementRequest;
import com.everrich.reconciliation.entities.AdvanceStatus;
import com.everrich.reconciliation.entities.EmployeeAdvance;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.LedgerRecordKind;
import com.everrich.reconciliation.entities.ReimbursementChannel;
import com.everrich.reconciliation.entities.ReimbursementStatus;
import com.everrich.reconciliation.exception.ConcurrencyConflictException;
import com.everrich.reconciliation.exception.ConflictingReconciliationModeException;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.exception.NotFoundException;
import com.everrich.reconciliation.repository.EmployeeAdvanceRepository;

/**
 * Lifecycle of expenses paid out of pocket by employees.
 *
 * An advance takes its expense out of bank reconciliation until it is cancelled.
 * Repayments move it PENDING -> PARTIAL -> COMPLETED and the expense's reimbursement
 * status follows the advance.
 */
@Service
public class AdvanceLedgerService {

    private static final Logger log = LoggerFactory.getLogger(AdvanceLedgerService.class);

    static final long WARNING_AFTER_DAYS = 7;
    static final long URGENT_AFTER_DAYS = 15;

    private final EmployeeAdvanceRepository advanceRepository;
    private final LedgerStoreService ledgerStore;
    private final AllocationService allocationService;
    private final Clock clock;

    public AdvanceLedgerService(EmployeeAdvanceRepository advanceRepository,
                                LedgerStoreService ledgerStore,
                                AllocationService allocationService,
                                Clock clock) {
        this.advanceRepository = advanceRepository;
        this.ledgerStore = ledgerStore;
        this.allocationService = allocationService;
        this.clock = clock;
    }

    public EmployeeAdvance createAdvance(AdvanceRequest request) {
        return allocationService.executeWithRetry("createAdvance for expense " + request.expenseId(),
                () -> doCreateAdvance(request));
    }

    /**
     * Books a repayment. Resending the same operation id leaves the advance as it is.
     */
    public EmployeeAdvance recordReimbursement(Long advanceId, ReimbursementRequest request) {
        return allocationService.executeWithRetry("recordReimbursement on advance " + advanceId,
                () -> doRecordReimbursement(advanceId, request));
    }

    public EmployeeAdvance cancelAdvance(Long advanceId, String reason, String actor) {
        return allocationService.executeWithRetry("cancelAdvance " + advanceId,
                () -> doCancelAdvance(advanceId, reason, actor));
    }

    @Transactional(readOnly = true)
    public EmployeeAdvance getAdvance(Long advanceId) {
        return advanceRepository.findById(advanceId)
                .orElseThrow(() -> new NotFoundException("Employee advance", advanceId));
    }

    @Transactional(readOnly = true)
    public List<EmployeeAdvance> listAdvances(AdvanceStatus status) {
        if (status == null) {
            return advanceRepository.findAllByOrderByAdvanceDateDesc();
        }
        return advanceRepository.findByStatusInOrderByAdvanceDateAsc(EnumSet.of(status));
    }

    @Transactional(readOnly = true)
    public List<EmployeeAdvance> listByEmployee(String employeeId) {
        return advanceRepository.findByEmployeeIdOrderByAdvanceDateDesc(employeeId);
    }

    /**
     * Open advances, oldest first, with days waiting and an urgency flag.
     */
    @Transactional(readOnly = true)
    public List<AdvanceAging> listPendingWithAging() {
        LocalDate today = LocalDate.now(clock);
        return advanceRepository.findByStatusInOrderByAdvanceDateAsc(EnumSet.of(AdvanceStatus.PENDING, AdvanceStatus.PARTIAL))
                .stream()
                .map(advance -> {
                    long days = ChronoUnit.DAYS.between(advance.getAdvanceDate(), today);
                    return AdvanceAging.of(advance, days, agingPriority(days));
                })
                .toList();
    }

    @Transactional(readOnly = true)
    public AdvanceSummary summary() {
        List<EmployeeAdvance> advances = advanceRepository.findAllByOrderByAdvanceDateDesc();
        AdvanceSummary summary = new AdvanceSummary();
        Map<String, long[]> perEmployee = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();

        for (EmployeeAdvance advance : advances) {
            summary.setTotalAdvances(summary.getTotalAdvances() + 1);
            switch (advance.getStatus()) {
                case PENDING, PARTIAL -> summary.setOpenAdvances(summary.getOpenAdvances() + 1);
                case COMPLETED -> summary.setCompletedAdvances(summary.getCompletedAdvances() + 1);
                case CANCELLED -> summary.setCancelledAdvances(summary.getCancelledAdvances() + 1);
            }
            if (advance.getStatus() == AdvanceStatus.CANCELLED) {
                continue;
            }
            summary.setTotalAdvanced(summary.getTotalAdvanced() + advance.getAdvanceAmount());
            summary.setTotalReimbursed(summary.getTotalReimbursed() + advance.getReimbursedAmount());
            summary.setTotalPending(summary.getTotalPending() + advance.getPendingAmount());

            long[] totals = perEmployee.computeIfAbsent(advance.getEmployeeId(), k -> new long[4]);
            names.putIfAbsent(advance.getEmployeeId(), advance.getEmployeeName());
            totals[0]++;
            totals[1] += advance.getAdvanceAmount();
            totals[2] += advance.getReimbursedAmount();
            totals[3] += advance.getPendingAmount();
        }

        List<AdvanceSummary.EmployeeTotals> employees = new ArrayList<>();
        perEmployee.forEach((employeeId, t) -> employees.add(
                new AdvanceSummary.EmployeeTotals(employeeId, names.get(employeeId), t[0], t[1], t[2], t[3])));
        summary.setEmployees(employees);
        return summary;
    }

    static AdvanceAging.Priority agingPriority(long daysPending) {
        if (daysPending > URGENT_AFTER_DAYS) {
            return AdvanceAging.Priority.URGENT;
        }
        if (daysPending > WARNING_AFTER_DAYS) {
            return AdvanceAging.Priority.WARNING;
        }
        return AdvanceAging.Priority.NORMAL;
    }

    private EmployeeAdvance doCreateAdvance(AdvanceRequest request) {
        ExpenseRecord expense = ledgerStore.getExpense(request.expenseId());
        if (expense.isEmployeeAdvance() || advanceRepository.findByExpenseId(expense.getId()).isPresent()) {
            throw new ConflictingReconciliationModeException("Expense " + expense.getId() + " is already an employee advance");
        }
        if (expense.getAmountReconciled() > 0) {
            throw new ConflictingReconciliationModeException("Expense " + expense.getId()
                    + " already has " + expense.getAmountReconciled() + " reconciled against the bank");
        }
        if (expense.getSplitGroupId() != null) {
            throw new ConflictingReconciliationModeException("Expense " + expense.getId()
                    + " belongs to split group " + expense.getSplitGroupId());
        }
        long amount = request.advanceAmount() != null ? request.advanceAmount() : expense.getAmount();
        if (amount <= 0 || amount > expense.getAmount()) {
            throw new InvalidStateException("Advance amount " + amount + " must be positive and at most the expense amount "
                    + expense.getAmount());
        }

        LocalDate advanceDate = request.advanceDate() != null ? request.advanceDate() : LocalDate.now(clock);
        EmployeeAdvance advance = new EmployeeAdvance(request.employeeId(), request.employeeName(), expense.getId(),
                amount, advanceDate);
        advance.setCompanyId(expense.getCompanyId());
        advance.setPaymentMethod(request.paymentMethod());
        advance.setNotes(request.notes());
        try {
            advance = advanceRepository.saveAndFlush(advance);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Advance for expense " + expense.getId() + " created concurrently", e);
        }

        expense.setEmployeeAdvance(true);
        expense.setAdvanceId(advance.getId());
        expense.setReimbursementStatus(ReimbursementStatus.PENDING);
        ledgerStore.setExpenseReconcilable(expense, false);

        log.info("Advance {} created for employee {} ({}) on expense {}: {} owed",
                advance.getId(), advance.getEmployeeId(), advance.getEmployeeName(), expense.getId(), amount);
        return advance;
    }

    private EmployeeAdvance doRecordReimbursement(Long advanceId, ReimbursementRequest request) {
        EmployeeAdvance advance = getAdvance(advanceId);
        String operationId = request.operationId();
        if (ledgerStore.isOperationApplied(operationId)) {
            log.info("Reimbursement operation {} already applied to advance {}", operationId, advanceId);
            return advance;
        }
        if (!advance.getStatus().isOpen()) {
            throw new InvalidStateException("Advance " + advanceId + " is " + advance.getStatus());
        }
        if (request.amount() <= 0 || request.amount() > advance.getPendingAmount()) {
            throw new InvalidStateException("Reimbursement of " + request.amount() + " must be positive and at most the "
                    + advance.getPendingAmount() + " still pending on advance " + advanceId);
        }

        if (request.movementId() != null) {
            allocationService.allocateReimbursement(request.movementId(), request.amount(), operationId + "/movement");
            advance.setReimbursementMovementId(request.movementId());
        }

        long reimbursed = advance.getReimbursedAmount() + request.amount();
        advance.setReimbursedAmount(reimbursed);
        recomputeAdvance(advance);
        if (request.channel() != null) {
            advance.setReimbursementChannel(request.channel());
        } else if (request.movementId() != null) {
            advance.setReimbursementChannel(ReimbursementChannel.TRANSFER);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        advance.setReimbursementDate(now);
        advance.setUpdatedAt(now);
        if (request.notes() != null) {
            advance.appendNote(request.notes());
        }
        EmployeeAdvance saved = advanceRepository.saveAndFlush(advance);

        ExpenseRecord expense = ledgerStore.getExpense(advance.getExpenseId());
        expense.setReimbursementStatus(saved.getStatus().toReimbursementStatus());
        ledgerStore.recordOperation(operationId, LedgerRecordKind.ADVANCE, advanceId, request.amount());

        log.info("Advance {} reimbursed {} via {}: {} of {} repaid, status {}", advanceId, request.amount(),
                saved.getReimbursementChannel(), reimbursed, saved.getAdvanceAmount(), saved.getStatus());
        return saved;
    }

    private EmployeeAdvance doCancelAdvance(Long advanceId, String reason, String actor) {
        EmployeeAdvance advance = getAdvance(advanceId);
        if (advance.getStatus() == AdvanceStatus.CANCELLED) {
            return advance;
        }
        if (!advance.getStatus().isOpen()) {
            throw new InvalidStateException("Advance " + advanceId + " is " + advance.getStatus() + " and cannot be cancelled");
        }
        advance.setStatus(AdvanceStatus.CANCELLED);
        advance.setUpdatedAt(LocalDateTime.now(clock));
        advance.appendNote("Cancelled by " + actor + (reason != null ? ": " + reason : ""));
        EmployeeAdvance saved = advanceRepository.saveAndFlush(advance);

        ExpenseRecord expense = ledgerStore.getExpense(advance.getExpenseId());
        expense.setEmployeeAdvance(false);
        expense.setAdvanceId(null);
        expense.setReimbursementStatus(ReimbursementStatus.NOT_REQUIRED);
        ledgerStore.setExpenseReconcilable(expense, true);

        log.info("Advance {} cancelled by {}, expense {} is reconcilable again", advanceId, actor, expense.getId());
        return saved;
    }

    /**
     * pending = advance - reimbursed; COMPLETED exactly when nothing is pending.
     */
    private void recomputeAdvance(EmployeeAdvance advance) {
        long pending = advance.getAdvanceAmount() - advance.getReimbursedAmount();
        advance.setPendingAmount(pending);
        if (pending == 0) {
            advance.setStatus(AdvanceStatus.COMPLETED);
        } else if (advance.getReimbursedAmount() > 0) {
            advance.setStatus(AdvanceStatus.PARTIAL);
        } else {
            advance.setStatus(AdvanceStatus.PENDING);
        }
    }
}
