package com.everrich.reconciliation.controller;

import java.util.List;

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

import com.everrich.reconciliation.dto.ExpenseRegistration;
import com.everrich.reconciliation.dto.MovementRegistration;
import com.everrich.reconciliation.entities.BankMovement;
import com.everrich.reconciliation.entities.ExpenseBankStatus;
import com.everrich.reconciliation.entities.ExpenseRecord;
import com.everrich.reconciliation.service.LedgerStoreService;

/**
 * Registration and lookup of bank movements and expenses for the upstream importers.
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    @Autowired
    private LedgerStoreService ledgerStore;

    @PostMapping("/movements")
    public ResponseEntity<BankMovement> registerMovement(@RequestBody MovementRegistration registration) {
        log.info("REST call to register bank movement for company {}", registration.companyId());
        return new ResponseEntity<>(ledgerStore.registerMovement(registration), HttpStatus.CREATED);
    }

    @GetMapping("/movements/{id}")
    public BankMovement getMovement(@PathVariable Long id) {
        return ledgerStore.getMovement(id);
    }

    @GetMapping("/movements")
    public List<BankMovement> listMovements(@RequestParam String companyId) {
        return ledgerStore.listMovements(companyId);
    }

    @PostMapping("/movements/{id}/cancel")
    public BankMovement cancelMovement(@PathVariable Long id) {
        return ledgerStore.cancelMovement(id);
    }

    @PostMapping("/expenses")
    public ResponseEntity<ExpenseRecord> registerExpense(@RequestBody ExpenseRegistration registration) {
        log.info("REST call to register expense for company {}", registration.companyId());
        return new ResponseEntity<>(ledgerStore.registerExpense(registration), HttpStatus.CREATED);
    }

    @GetMapping("/expenses/{id}")
    public ExpenseRecord getExpense(@PathVariable Long id) {
        return ledgerStore.getExpense(id);
    }

    @GetMapping("/expenses")
    public List<ExpenseRecord> listExpenses(@RequestParam String companyId,
                                            @RequestParam(defaultValue = "UNRECONCILED") ExpenseBankStatus status) {
        return ledgerStore.listExpenses(companyId, status);
    }
}
