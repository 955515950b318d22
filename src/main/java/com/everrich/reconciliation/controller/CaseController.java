package com.everrich.reconciliation.controller;

import java.security.Principal;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.reconciliation.dto.BulkCaseReport;
import com.everrich.reconciliation.dto.BulkCaseRequest;
import com.everrich.reconciliation.dto.CaseRequest;
import com.everrich.reconciliation.dto.ReasonCodeInfo;
import com.everrich.reconciliation.entities.CaseHistoryEntry;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.service.EscalationService;

/**
 * Administrative surface for non-reconciliation cases.
 */
@RestController
@RequestMapping("/api/cases")
public class CaseController {

    private static final Logger log = LoggerFactory.getLogger(CaseController.class);

    @Autowired
    private EscalationService escalationService;

    @PostMapping
    public ResponseEntity<NonReconciliationCase> open(@RequestBody CaseRequest request, Principal principal) {
        NonReconciliationCase created = escalationService.openCase(request.withActor(principal.getName()));
        return new ResponseEntity<>(created, HttpStatus.CREATED);
    }

    @PostMapping("/bulk-actions")
    public BulkCaseReport bulkAction(@RequestBody BulkCaseRequest request, Principal principal) {
        log.info("REST call to bulk {} {} cases by {}", request.action(),
                request.caseIds() != null ? request.caseIds().size() : 0, principal.getName());
        return escalationService.bulkAction(request.withActor(principal.getName()));
    }

    @GetMapping("/reason-codes")
    public List<ReasonCodeInfo> reasonCodes() {
        return escalationService.reasonCodes();
    }

    @GetMapping("/{id}")
    public NonReconciliationCase get(@PathVariable Long id) {
        return escalationService.getCase(id);
    }

    @GetMapping
    public List<NonReconciliationCase> list(@RequestParam String companyId,
                                            @RequestParam(defaultValue = "true") boolean openOnly) {
        return escalationService.listCases(companyId, openOnly);
    }

    @GetMapping("/{id}/history")
    public List<CaseHistoryEntry> history(@PathVariable Long id) {
        return escalationService.history(id);
    }

    /**
     * Applies one of start, resolve, dismiss, hold, require-approval or release.
     */
    @PostMapping("/{id}/{action}")
    public NonReconciliationCase transition(@PathVariable Long id, @PathVariable String action,
                                            @RequestBody(required = false) Map<String, String> body,
                                            Principal principal) {
        String notes = body != null ? body.get("notes") : null;
        String actor = principal.getName();
        log.info("REST call to {} case {} by {}", action, id, actor);
        switch (action) {
            case "start":
                return escalationService.startWork(id, actor, notes);
            case "resolve":
                return escalationService.resolve(id, actor, notes);
            case "dismiss":
                return escalationService.dismiss(id, actor, notes);
            case "hold":
                return escalationService.hold(id, actor, notes);
            case "require-approval":
                return escalationService.requireApproval(id, actor, notes);
            case "release":
                return escalationService.release(id, actor, notes);
            default:
                throw new InvalidStateException("Unknown case action: " + action);
        }
    }
}
