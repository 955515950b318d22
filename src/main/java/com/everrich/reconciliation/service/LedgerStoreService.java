package com.everrich.reconciliation.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.reconciliation.dto.ExpenseRegistration;
import com.everrich.reconciliation.dto.MovementRegistration;
import com.everrich.reconciliation.entities.AppliedOperation;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseBankStatus;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.entities.LedgerRecordKind;
import com.everrich.reconciliation.entities.MovementDirection;
import com.everrich.reconciliation.entities.MovementStatus;
import com.everrich.reconciliation.entities.ReconciliationMode;
import com.everrich.reconciliation.exception.ConcurrencyConflictException;
import com.everrich.reconciliation.exception.ConflictingReconciliationModeException;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.exception.NotFoundException;
import com.everrich.reconciliation.repository.AppliedOperationRepository;
import com.everrich.reconciliation.repository.BankMovementRepository;
import com.everrich.reconciliation.repository.ExpenseRecordRepository;

/**
 * Owner of bank movements and expense records and their reconciliation fields.
 *
 * Every allocation change is a signed delta tagged with an operation id. A delta whose
 * operation id was already applied is ignored, so callers may safely resend. Derived fields
 * are recomputed by {@link #recomputeMovement(BankMovement)} and {@link #recomputeExpense(ExpenseRecord)}
 * in the same transaction as the change.
 */
@Service
public class LedgerStoreService {

    private static final Logger log = LoggerFactory.getLogger(LedgerStoreService.class);

    private final BankMovementRepository movementRepository;
    private final ExpenseRecordRepository expenseRepository;
    private final AppliedOperationRepository appliedOperationRepository;

    public LedgerStoreService(BankMovementRepository movementRepository,
                              ExpenseRecordRepository expenseRepository,
                              AppliedOperationRepository appliedOperationRepository) {
        this.movementRepository = movementRepository;
        this.expenseRepository = expenseRepository;
        this.appliedOperationRepository = appliedOperationRepository;
    }

    public BankMovement getMovement(Long id) {
        return movementRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Bank movement", id));
    }

    public ExpenseRecord getExpense(Long id) {
        return expenseRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Expense", id));
    }

    public List<BankMovement> listMovements(String companyId) {
        return movementRepository.findByCompanyIdOrderByTransactionDateDesc(companyId);
    }

    public List<ExpenseRecord> listExpenses(String companyId, ExpenseBankStatus status) {
        return expenseRepository.findByCompanyIdAndBankStatus(companyId, status);
    }

    @Transactional
    public BankMovement registerMovement(MovementRegistration registration) {
        if (registration.amount() == 0) {
            throw new InvalidStateException("Bank movement amount must not be zero");
        }
        BankMovement movement = new BankMovement(registration.companyId(), registration.amount(),
                registration.currency(), registration.transactionDate(), registration.description());
        BankMovement saved = movementRepository.save(movement);
        log.info("Registered bank movement {} for company {}: {} {} ({})", saved.getId(), saved.getCompanyId(),
                saved.getAmount(), saved.getCurrency(), saved.getDirection());
        return saved;
    }

    @Transactional
    public ExpenseRecord registerExpense(ExpenseRegistration registration) {
        if (registration.amount() <= 0) {
            throw new InvalidStateException("Expense amount must be positive");
        }
        ExpenseRecord expense = new ExpenseRecord(registration.companyId(), registration.description(),
                registration.amount(), registration.currency(), registration.expenseDate());
        ExpenseRecord saved = expenseRepository.save(expense);
        log.info("Registered expense {} for company {}: {} {}", saved.getId(), saved.getCompanyId(),
                saved.getAmount(), saved.getCurrency());
        return saved;
    }

    /**
     * Applies {@code delta} to the allocated amount of a movement.
     *
     * @param direction direction the movement must have for this allocation, or null to skip the check
     *                  (releases of an earlier allocation)
     * @return the movement after the change, or unchanged when the operation was already applied
     */
    @Transactional
    public BankMovement updateMovementAllocation(Long id, long delta, String operationId, MovementDirection direction) {
        BankMovement movement = getMovement(id);
        if (isOperationApplied(operationId)) {
            log.debug("Operation {} already applied, movement {} unchanged", operationId, id);
            return movement;
        }
        if (movement.getStatus() == MovementStatus.CANCELLED) {
            throw new InvalidStateException("Bank movement " + id + " is cancelled");
        }
        if (direction != null && movement.getDirection() != direction) {
            throw new InvalidStateException("Bank movement " + id + " is a " + movement.getDirection()
                    + " and cannot take a " + direction + " allocation");
        }
        long allocated = movement.getAmountAllocated() + delta;
        if (allocated < 0 || allocated > movement.getAbsoluteAmount()) {
            throw new InvalidStateException("Allocating " + delta + " to bank movement " + id + " would leave "
                    + allocated + " allocated of " + movement.getAbsoluteAmount());
        }
        movement.setAmountAllocated(allocated);
        recomputeMovement(movement);
        BankMovement saved = movementRepository.saveAndFlush(movement);
        recordOperation(operationId, LedgerRecordKind.MOVEMENT, id, delta);
        log.debug("Movement {} allocated {} (delta {}, op {})", id, allocated, delta, operationId);
        return saved;
    }

    /**
     * Applies {@code delta} to the reconciled amount of an expense.
     *
     * @return the expense after the change, or unchanged when the operation was already applied
     */
    @Transactional
    public ExpenseRecord updateExpenseReconciliation(Long id, long delta, String operationId) {
        ExpenseRecord expense = getExpense(id);
        if (isOperationApplied(operationId)) {
            log.debug("Operation {} already applied, expense {} unchanged", operationId, id);
            return expense;
        }
        if (expense.getBankStatus() == ExpenseBankStatus.NON_RECONCILABLE) {
            throw new ConflictingReconciliationModeException("Expense " + id
                    + " awaits advance reimbursement and cannot be reconciled against the bank");
        }
        long reconciled = expense.getAmountReconciled() + delta;
        if (reconciled < 0 || reconciled > expense.getAmount()) {
            throw new InvalidStateException("Reconciling " + delta + " on expense " + id + " would leave "
                    + reconciled + " reconciled of " + expense.getAmount());
        }
        expense.setAmountReconciled(reconciled);
        recomputeExpense(expense);
        ExpenseRecord saved = expenseRepository.saveAndFlush(expense);
        recordOperation(operationId, LedgerRecordKind.EXPENSE, id, delta);
        log.debug("Expense {} reconciled {} (delta {}, op {})", id, reconciled, delta, operationId);
        return saved;
    }

    /**
     * Links a movement to a split group, or unlinks it when {@code groupId} is null.
     */
    @Transactional
    public BankMovement assignMovementGroup(Long id, String groupId) {
        BankMovement movement = getMovement(id);
        movement.setSplitGroupId(groupId);
        recomputeMovement(movement);
        return movementRepository.saveAndFlush(movement);
    }

    @Transactional
    public ExpenseRecord assignExpenseGroup(Long id, String groupId) {
        ExpenseRecord expense = getExpense(id);
        expense.setSplitGroupId(groupId);
        recomputeExpense(expense);
        return expenseRepository.saveAndFlush(expense);
    }

    /**
     * Takes an expense out of bank reconciliation, or puts it back when {@code reconcilable} is true.
     */
    @Transactional
    public ExpenseRecord setExpenseReconcilable(ExpenseRecord expense, boolean reconcilable) {
        if (reconcilable) {
            expense.setBankStatus(ExpenseBankStatus.UNRECONCILED);
            recomputeExpense(expense);
        } else {
            if (expense.getAmountReconciled() != 0) {
                throw new InvalidStateException("Expense " + expense.getId() + " already has reconciled amount");
            }
            expense.setBankStatus(ExpenseBankStatus.NON_RECONCILABLE);
        }
        return expenseRepository.saveAndFlush(expense);
    }

    @Transactional
    public BankMovement cancelMovement(Long id) {
        BankMovement movement = getMovement(id);
        if (movement.getAmountAllocated() != 0) {
            throw new InvalidStateException("Bank movement " + id + " still has allocations");
        }
        movement.setStatus(MovementStatus.CANCELLED);
        log.info("Bank movement {} cancelled", id);
        return movementRepository.save(movement);
    }

    public void recomputeMovement(BankMovement movement) {
        movement.setAmountUnallocated(movement.getAbsoluteAmount() - movement.getAmountAllocated());
        movement.setReconciliationMode(modeFor(movement.getSplitGroupId(), movement.getAmountAllocated(),
                movement.getAmountUnallocated()));
    }

    public void recomputeExpense(ExpenseRecord expense) {
        long pending = expense.getAmount() - expense.getAmountReconciled();
        expense.setAmountPending(pending);
        expense.setReconciliationMode(modeFor(expense.getSplitGroupId(), expense.getAmountReconciled(), pending));
        if (expense.getBankStatus() == ExpenseBankStatus.NON_RECONCILABLE) {
            return;
        }
        if (expense.getAmountReconciled() == 0) {
            expense.setBankStatus(ExpenseBankStatus.UNRECONCILED);
        } else if (pending == 0) {
            expense.setBankStatus(ExpenseBankStatus.RECONCILED);
        } else {
            expense.setBankStatus(ExpenseBankStatus.PARTIALLY_RECONCILED);
        }
    }

    private ReconciliationMode modeFor(String splitGroupId, long applied, long remaining) {
        if (splitGroupId != null) {
            return ReconciliationMode.SPLIT;
        }
        return applied > 0 && remaining > 0 ? ReconciliationMode.PARTIAL : ReconciliationMode.SIMPLE;
    }

    public boolean isOperationApplied(String operationId) {
        if (operationId == null || operationId.isBlank()) {
            throw new InvalidStateException("An operation id is required for ledger updates");
        }
        return appliedOperationRepository.existsByOperationId(operationId);
    }

    /**
     * Records {@code operationId} as applied. A concurrent writer that recorded it first
     * surfaces as {@link ConcurrencyConflictException}.
     */
    public void recordOperation(String operationId, LedgerRecordKind kind, Long recordId, long delta) {
        try {
            appliedOperationRepository.saveAndFlush(new AppliedOperation(operationId, kind, recordId, delta));
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Operation " + operationId + " applied concurrently", e);
        }
    }
}
