package com.everrich.reconciliation.controller;

import java.security.Principal;
import java.util.List;
import java.util.Map;

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

import com.everrich.reconciliation.dto.AdvanceAging;
import com.everrich.reconciliation.dto.AdvanceRequest;
import com.everrich.reconciliation.dto.AdvanceSummary;
import com.everrich.reconciliation.dto.ReimbursementRequest;
import com.everrich.reconciliation.entities.AdvanceStatus;
import com.everrich.reconciliation.entities.EmployeeAdvance;
import com.everrich.reconciliation.service.AdvanceLedgerService;

@RestController
@RequestMapping("/api/advances")
public class AdvanceController {

    @Autowired
    private AdvanceLedgerService advanceService;

    @PostMapping
    public ResponseEntity<EmployeeAdvance> create(@RequestBody AdvanceRequest request) {
        return new ResponseEntity<>(advanceService.createAdvance(request), HttpStatus.CREATED);
    }

    @PostMapping("/{id}/reimbursements")
    public EmployeeAdvance reimburse(@PathVariable Long id, @RequestBody ReimbursementRequest request) {
        return advanceService.recordReimbursement(id, request);
    }

    @PostMapping("/{id}/cancel")
    public EmployeeAdvance cancel(@PathVariable Long id, @RequestBody(required = false) Map<String, String> body,
                                  Principal principal) {
        String reason = body != null ? body.get("reason") : null;
        return advanceService.cancelAdvance(id, reason, principal.getName());
    }

    @GetMapping("/{id}")
    public EmployeeAdvance get(@PathVariable Long id) {
        return advanceService.getAdvance(id);
    }

    @GetMapping
    public List<EmployeeAdvance> list(@RequestParam(required = false) AdvanceStatus status) {
        return advanceService.listAdvances(status);
    }

    @GetMapping("/employee/{employeeId}")
    public List<EmployeeAdvance> byEmployee(@PathVariable String employeeId) {
        return advanceService.listByEmployee(employeeId);
    }

    @GetMapping("/pending")
    public List<AdvanceAging> pending() {
        return advanceService.listPendingWithAging();
    }

    @GetMapping("/summary")
    public AdvanceSummary summary() {
        return advanceService.summary();
    }
}
