package com.everrich.reconciliation.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.everrich.reconciliation.config.ReconciliationProperties;
import com.everrich.reconciliation.dto.BulkCaseReport;
import com.everrich.reconciliation.dto.BulkCaseRequest;
import com.everrich.reconciliation.dto.CaseRequest;
import com.everrich.reconciliation.dto.ReasonCodeInfo;
import com.everrich.reconciliation.dto.SweepReport;
import com.everrich.reconciliation.entities.BusinessImpact;
import com.everrich.reconciliation.entities.CaseActionType;
import com.everrich.reconciliation.entities.CaseHistoryEntry;
import com.everrich.reconciliation.entities.CaseStatus;
import com.everrich.reconciliation.entities.EscalationRule;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.entities.NotificationType;
import com.everrich.reconciliation.entities.ReasonCode;
import com.everrich.reconciliation.entities.RecipientType;
import com.everrich.reconciliation.exception.ConcurrencyConflictException;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.exception.LedgerException;
import com.everrich.reconciliation.exception.NotFoundException;
import com.everrich.reconciliation.exception.RuleEvaluationException;
import com.everrich.reconciliation.repository.CaseHistoryRepository;
import com.everrich.reconciliation.repository.NonReconciliationCaseRepository;

/**
 * Workflow of non-reconciliation cases: opening, manual transitions, time-driven
 * escalation and system resolution once an allocation covers the record.
 * Every transition appends a history entry.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    private final NonReconciliationCaseRepository caseRepository;
    private final CaseHistoryRepository historyRepository;
    private final EscalationRuleEvaluator ruleEvaluator;
    private final NotificationPublisher notificationPublisher;
    private final LedgerStoreService ledgerStore;
    private final AllocationService allocationService;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public EscalationService(NonReconciliationCaseRepository caseRepository,
                             CaseHistoryRepository historyRepository,
                             EscalationRuleEvaluator ruleEvaluator,
                             NotificationPublisher notificationPublisher,
                             LedgerStoreService ledgerStore,
                             AllocationService allocationService,
                             ReconciliationProperties properties,
                             Clock clock) {
        this.caseRepository = caseRepository;
        this.historyRepository = historyRepository;
        this.ruleEvaluator = ruleEvaluator;
        this.notificationPublisher = notificationPublisher;
        this.ledgerStore = ledgerStore;
        this.allocationService = allocationService;
        this.properties = properties;
        this.clock = clock;
    }

    public NonReconciliationCase openCase(CaseRequest request) {
        return allocationService.executeWithRetry("openCase " + request.reasonCode(), () -> doOpenCase(request));
    }

    public NonReconciliationCase startWork(Long caseId, String actor, String notes) {
        return transition(caseId, CaseStatus.IN_PROGRESS, CaseActionType.WORKFLOW_ADVANCED, actor, notes);
    }

    public NonReconciliationCase resolve(Long caseId, String actor, String notes) {
        return transition(caseId, CaseStatus.RESOLVED, CaseActionType.RESOLVED, actor, notes);
    }

    public NonReconciliationCase dismiss(Long caseId, String actor, String notes) {
        return transition(caseId, CaseStatus.DISMISSED, CaseActionType.DISMISSED, actor, notes);
    }

    public NonReconciliationCase hold(Long caseId, String actor, String notes) {
        return transition(caseId, CaseStatus.ON_HOLD, CaseActionType.STATUS_CHANGED, actor, notes);
    }

    public NonReconciliationCase requireApproval(Long caseId, String actor, String notes) {
        return transition(caseId, CaseStatus.REQUIRES_APPROVAL, CaseActionType.STATUS_CHANGED, actor, notes);
    }

    /**
     * Ends a hold and puts the case back in the status it had before.
     */
    public NonReconciliationCase release(Long caseId, String actor, String notes) {
        return allocationService.executeWithRetry("release case " + caseId, () -> {
            NonReconciliationCase nrCase = loadCase(caseId);
            if (!nrCase.getStatus().isHold()) {
                throw new InvalidStateException("Case " + caseId + " is " + nrCase.getStatus() + ", not on hold");
            }
            CaseStatus previous = nrCase.getStatus();
            CaseStatus restored = nrCase.getStatusBeforeHold() != null ? nrCase.getStatusBeforeHold() : CaseStatus.PENDING;
            nrCase.setStatus(restored);
            nrCase.setStatusBeforeHold(null);
            touch(nrCase, actor);
            caseRepository.saveAndFlush(nrCase);
            appendHistory(nrCase, CaseActionType.STATUS_CHANGED, "Hold released", previous, actor, false, null, notes);
            log.info("Case {} released from {} back to {} by {}", caseId, previous, restored, actor);
            return nrCase;
        });
    }

    /**
     * Applies one action to each listed case in its own transaction. A case that cannot take the
     * action is counted as failed and the rest carry on.
     */
    public BulkCaseReport bulkAction(BulkCaseRequest request) {
        if (request.action() == null || request.caseIds() == null || request.caseIds().isEmpty()) {
            throw new InvalidStateException("A bulk action needs an action and at least one case");
        }
        Set<Long> caseIds = new LinkedHashSet<>(request.caseIds());
        Map<Long, String> failures = new LinkedHashMap<>();
        int succeeded = 0;
        for (Long caseId : caseIds) {
            try {
                switch (request.action()) {
                    case RESOLVE:
                        resolve(caseId, request.actor(), request.notes());
                        break;
                    case DISMISS:
                        dismiss(caseId, request.actor(), request.notes());
                        break;
                    case HOLD:
                    default:
                        hold(caseId, request.actor(), request.notes());
                        break;
                }
                succeeded++;
            } catch (LedgerException e) {
                failures.put(caseId, e.getMessage());
                log.warn("Bulk {} left case {} unchanged: {}", request.action(), caseId, e.getMessage());
            } catch (RuntimeException e) {
                failures.put(caseId, e.getMessage());
                log.error("Bulk {} of case {} failed", request.action(), caseId, e);
            }
        }
        log.info("Bulk {} by {}: {} of {} cases done, {} failed", request.action(), request.actor(), succeeded,
                caseIds.size(), failures.size());
        return new BulkCaseReport(request.action(), caseIds.size(), succeeded, failures.size(), failures);
    }

    public List<ReasonCodeInfo> reasonCodes() {
        return Arrays.stream(ReasonCode.values()).map(ReasonCodeInfo::of).toList();
    }

    @Transactional(readOnly = true)
    public NonReconciliationCase getCase(Long caseId) {
        return loadCase(caseId);
    }

    @Transactional(readOnly = true)
    public List<NonReconciliationCase> listCases(String companyId, boolean openOnly) {
        return openOnly
                ? caseRepository.findByCompanyIdAndStatusIn(companyId, CaseStatus.open())
                : caseRepository.findByCompanyId(companyId);
    }

    @Transactional(readOnly = true)
    public List<CaseHistoryEntry> history(Long caseId) {
        loadCase(caseId);
        return historyRepository.findByCaseIdOrderByIdAsc(caseId);
    }

    /**
     * Resolves every open case of an expense on behalf of the system. Joins the caller's transaction.
     *
     * @return number of cases resolved
     */
    @Transactional
    public int supersedeByAllocation(Long expenseId, String correlationId) {
        return supersede(caseRepository.findByExpenseIdAndStatusIn(expenseId, CaseStatus.open()),
                "expense " + expenseId, correlationId);
    }

    /**
     * Same as {@link #supersedeByAllocation(Long, String)} for the cases of a bank movement.
     */
    @Transactional
    public int supersedeMovementByAllocation(Long movementId, String correlationId) {
        return supersede(caseRepository.findByMovementIdAndStatusIn(movementId, CaseStatus.open()),
                "movement " + movementId, correlationId);
    }

    @EventListener
    public void onSplitGroupCompleted(SplitGroupCompletedEvent event) {
        int resolved = event.expenseIds().stream()
                .distinct()
                .mapToInt(expenseId -> supersedeByAllocation(expenseId, event.groupId()))
                .sum();
        resolved += event.movementIds().stream()
                .distinct()
                .mapToInt(movementId -> supersedeMovementByAllocation(movementId, event.groupId()))
                .sum();
        if (resolved > 0) {
            log.info("Split group {} completion resolved {} open cases", event.groupId(), resolved);
        }
    }

    private int supersede(List<NonReconciliationCase> open, String record, String correlationId) {
        String actor = properties.getSystemActor();
        for (NonReconciliationCase nrCase : open) {
            CaseStatus previous = nrCase.getStatus();
            applyTerminal(nrCase, CaseStatus.RESOLVED, actor, "Superseded by allocation " + correlationId);
            caseRepository.saveAndFlush(nrCase);
            appendHistory(nrCase, CaseActionType.RESOLVED, "Resolved by completed allocation", previous, actor, true,
                    correlationId, null);
            log.info("Case {} on {} resolved by split group {}", nrCase.getId(), record, correlationId);
        }
        return open.size();
    }

    /**
     * Escalates every sweepable case whose next escalation date is at or before {@code now}.
     * Each case runs in its own transaction; a failing case is logged and counted and the
     * sweep carries on with the rest.
     */
    public SweepReport sweep(LocalDateTime now) {
        String sweepId = UUID.randomUUID().toString();
        List<Long> due = caseRepository.findDueForEscalation(CaseStatus.sweepable(), now);
        log.info("Escalation sweep {} at {}: {} cases due", sweepId, now, due.size());

        int escalated = 0;
        int skipped = 0;
        int failed = 0;
        for (Long caseId : due) {
            try {
                Boolean done = allocationService.executeWithRetry("escalate case " + caseId,
                        () -> escalateIfDue(caseId, now, sweepId));
                if (Boolean.TRUE.equals(done)) {
                    escalated++;
                } else {
                    skipped++;
                }
            } catch (RuleEvaluationException e) {
                failed++;
                log.error("Case {} left unescalated, rule {} is malformed", caseId, e.getRuleCode(), e);
            } catch (RuntimeException e) {
                failed++;
                log.error("Escalation of case {} failed during sweep {}", caseId, sweepId, e);
            }
        }
        log.info("Escalation sweep {} finished: {} escalated, {} skipped, {} failed", sweepId, escalated, skipped, failed);
        return new SweepReport(due.size(), escalated, skipped, failed);
    }

    /**
     * One sweep step. Re-reads the case so that a concurrent resolution is respected.
     *
     * @return true when the case was escalated
     */
    boolean escalateIfDue(Long caseId, LocalDateTime now, String sweepId) {
        NonReconciliationCase nrCase = caseRepository.findById(caseId).orElse(null);
        if (nrCase == null || !nrCase.getStatus().canTransitionTo(CaseStatus.ESCALATED)
                || nrCase.getNextEscalationDate() == null || nrCase.getNextEscalationDate().isAfter(now)) {
            return false;
        }
        EscalationPlan plan = ruleEvaluator.evaluate(nrCase);

        CaseStatus previous = nrCase.getStatus();
        int fromLevel = nrCase.getEscalationLevel();
        int toLevel = Math.min(fromLevel + 1, properties.getEscalation().getMaxLevel());
        nrCase.setEscalationLevel(toLevel);
        nrCase.setStatus(CaseStatus.ESCALATED);
        nrCase.setNextEscalationDate(now.plusDays(plan.afterDays()));
        nrCase.setEscalationRuleCode(plan.ruleCode());
        EscalationRule rule = plan.rule();
        if (rule != null && rule.getRecipientType() == RecipientType.USER) {
            nrCase.setEscalatedTo(rule.getRecipientIdentifier());
        }
        nrCase.setUpdatedBy(properties.getSystemActor());
        nrCase.setUpdatedAt(now);
        caseRepository.saveAndFlush(nrCase);

        appendHistory(nrCase, CaseActionType.ESCALATED, "Escalated from level " + fromLevel + " to " + toLevel,
                previous, properties.getSystemActor(), true, sweepId, null);
        Map<String, Object> payload = casePayload(nrCase);
        payload.put("previousLevel", fromLevel);
        payload.put("ruleCode", plan.ruleCode());
        notify(nrCase, NotificationType.ESCALATION_OCCURRED, rule, payload);
        log.info("Case {} escalated to level {} (rule {})", caseId, toLevel, plan.ruleCode());
        return true;
    }

    private NonReconciliationCase doOpenCase(CaseRequest request) {
        if (request.reasonCode() == null) {
            throw new InvalidStateException("A reason code is required");
        }
        if ((request.expenseId() == null) == (request.movementId() == null)) {
            throw new InvalidStateException("A case concerns exactly one expense or one bank movement");
        }
        if (request.amount() < 0) {
            throw new InvalidStateException("Case amount must not be negative");
        }
        String companyId;
        if (request.expenseId() != null) {
            companyId = ledgerStore.getExpense(request.expenseId()).getCompanyId();
            if (caseRepository.existsByExpenseIdAndReasonCode(request.expenseId(), request.reasonCode())) {
                throw new InvalidStateException("Expense " + request.expenseId() + " already has a "
                        + request.reasonCode() + " case");
            }
        } else {
            companyId = ledgerStore.getMovement(request.movementId()).getCompanyId();
            if (caseRepository.existsByMovementIdAndReasonCode(request.movementId(), request.reasonCode())) {
                throw new InvalidStateException("Bank movement " + request.movementId() + " already has a "
                        + request.reasonCode() + " case");
            }
        }
        if (request.companyId() != null && !request.companyId().equals(companyId)) {
            throw new InvalidStateException("Record belongs to company " + companyId + ", not " + request.companyId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        NonReconciliationCase nrCase = new NonReconciliationCase(companyId, request.reasonCode(), request.amount(),
                request.actor(), now);
        nrCase.setExpenseId(request.expenseId());
        nrCase.setMovementId(request.movementId());
        nrCase.setReasonDescription(request.reasonDescription() != null
                ? request.reasonDescription() : request.reasonCode().getDisplayName());
        BusinessImpact impact = request.businessImpact() != null ? request.businessImpact() : impactFor(request.amount());
        nrCase.setBusinessImpact(impact);
        nrCase.setResolutionPriority(request.resolutionPriority() != null
                ? request.resolutionPriority() : impact.getDefaultPriority());
        nrCase.setEstimatedResolutionDate(now.plusDays(request.reasonCode().getTypicalResolutionDays()));

        try {
            EscalationPlan plan = ruleEvaluator.evaluate(nrCase);
            nrCase.setNextEscalationDate(now.plusDays(plan.afterDays()));
            nrCase.setEscalationRuleCode(plan.ruleCode());
        } catch (RuleEvaluationException e) {
            log.error("Case for {} opened without an escalation date, rule {} is malformed",
                    request.reasonCode(), e.getRuleCode(), e);
            nrCase.setEscalationRuleCode(e.getRuleCode());
        }

        try {
            nrCase = caseRepository.saveAndFlush(nrCase);
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Case for " + request.reasonCode() + " opened concurrently", e);
        }
        appendHistory(nrCase, CaseActionType.CREATED, "Case opened: " + nrCase.getReasonDescription(), null,
                request.actor(), false, null, null);
        log.info("Case {} opened for company {} ({}, amount {}, impact {}), next escalation {}", nrCase.getId(),
                companyId, request.reasonCode(), request.amount(), impact, nrCase.getNextEscalationDate());
        return nrCase;
    }

    private NonReconciliationCase transition(Long caseId, CaseStatus target, CaseActionType action, String actor,
                                             String notes) {
        return allocationService.executeWithRetry(target + " case " + caseId, () -> {
            NonReconciliationCase nrCase = loadCase(caseId);
            CaseStatus previous = nrCase.getStatus();
            if (!previous.canTransitionTo(target)) {
                throw new InvalidStateException("Case " + caseId + " cannot move from " + previous + " to " + target);
            }
            if (target.isTerminal()) {
                applyTerminal(nrCase, target, actor, notes);
            } else {
                if (target.isHold() && !previous.isHold()) {
                    nrCase.setStatusBeforeHold(previous);
                }
                nrCase.setStatus(target);
                touch(nrCase, actor);
            }
            caseRepository.saveAndFlush(nrCase);
            appendHistory(nrCase, action, previous + " -> " + target, previous, actor, false, null, notes);

            if (target == CaseStatus.RESOLVED || target == CaseStatus.DISMISSED) {
                notify(nrCase, NotificationType.RESOLUTION_COMPLETED, null, casePayload(nrCase));
            } else if (target == CaseStatus.REQUIRES_APPROVAL) {
                notify(nrCase, NotificationType.MANUAL_REVIEW_REQUIRED, null, casePayload(nrCase));
            }
            log.info("Case {} moved from {} to {} by {}", caseId, previous, target, actor);
            return nrCase;
        });
    }

    private void applyTerminal(NonReconciliationCase nrCase, CaseStatus target, String actor, String notes) {
        LocalDateTime now = LocalDateTime.now(clock);
        nrCase.setStatus(target);
        nrCase.setStatusBeforeHold(null);
        nrCase.setNextEscalationDate(null);
        nrCase.setActualResolutionDate(now);
        nrCase.setResolutionNotes(notes);
        nrCase.setUpdatedBy(actor);
        nrCase.setUpdatedAt(now);
    }

    private void touch(NonReconciliationCase nrCase, String actor) {
        nrCase.setUpdatedBy(actor);
        nrCase.setUpdatedAt(LocalDateTime.now(clock));
    }

    private void appendHistory(NonReconciliationCase nrCase, CaseActionType action, String description,
                               CaseStatus previous, String actor, boolean system, String correlationId, String notes) {
        historyRepository.save(new CaseHistoryEntry(nrCase.getId(), action, description, previous, nrCase.getStatus(),
                actor, LocalDateTime.now(clock), system, correlationId, notes));
    }

    private void notify(NonReconciliationCase nrCase, NotificationType type, EscalationRule rule,
                        Map<String, Object> payload) {
        RecipientType recipientType = RecipientType.ROLE;
        String recipient = properties.getEscalation().getDefaultRecipient();
        String template = properties.getEscalation().getDefaultTemplate();
        if (rule != null && rule.getRecipientType() != null) {
            recipientType = rule.getRecipientType();
            recipient = rule.getRecipientIdentifier();
        }
        if (rule != null && rule.getTemplateId() != null) {
            template = rule.getTemplateId();
        }
        notificationPublisher.enqueue(nrCase.getId(), type, recipientType, recipient, template, payload);
    }

    private Map<String, Object> casePayload(NonReconciliationCase nrCase) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("caseId", nrCase.getId());
        payload.put("companyId", nrCase.getCompanyId());
        payload.put("reasonCode", nrCase.getReasonCode().name());
        payload.put("reason", nrCase.getReasonDescription());
        payload.put("status", nrCase.getStatus().name());
        payload.put("escalationLevel", nrCase.getEscalationLevel());
        payload.put("amount", nrCase.getAmount());
        payload.put("businessImpact", nrCase.getBusinessImpact().name());
        if (nrCase.getExpenseId() != null) {
            payload.put("expenseId", nrCase.getExpenseId());
        }
        if (nrCase.getMovementId() != null) {
            payload.put("movementId", nrCase.getMovementId());
        }
        return payload;
    }

    BusinessImpact impactFor(long amount) {
        ReconciliationProperties.Escalation config = properties.getEscalation();
        if (amount >= config.getCriticalImpactAmount()) {
            return BusinessImpact.CRITICAL;
        }
        if (amount >= config.getHighImpactAmount()) {
            return BusinessImpact.HIGH;
        }
        if (amount >= config.getMediumImpactAmount()) {
            return BusinessImpact.MEDIUM;
        }
        return BusinessImpact.LOW;
    }

    private NonReconciliationCase loadCase(Long caseId) {
        return caseRepository.findById(caseId)
                .orElseThrow(() -> new NotFoundException("Case", caseId));
    }
}
