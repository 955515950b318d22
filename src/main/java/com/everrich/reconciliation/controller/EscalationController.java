package com.everrich.reconciliation.controller;

import java.security.Principal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.reconciliation.dto.SweepReport;
import com.everrich.reconciliation.entities.EscalationRule;
import com.everrich.reconciliation.service.EscalationRuleService;
import com.everrich.reconciliation.service.EscalationService;

@RestController
@RequestMapping("/api/escalation")
public class EscalationController {

    @Autowired
    private EscalationService escalationService;

    @Autowired
    private EscalationRuleService ruleService;

    @Autowired
    private Clock clock;

    @PostMapping("/sweep")
    public SweepReport sweep(@RequestParam(required = false)
                             @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at) {
        return escalationService.sweep(at != null ? at : LocalDateTime.now(clock));
    }

    @GetMapping("/rules")
    public List<EscalationRule> listRules(@RequestParam String companyId) {
        return ruleService.listRules(companyId);
    }

    @GetMapping("/rules/{id}")
    public EscalationRule getRule(@PathVariable Long id) {
        return ruleService.getRule(id);
    }

    @PostMapping("/rules")
    public ResponseEntity<EscalationRule> createRule(@RequestBody EscalationRule rule, Principal principal) {
        return new ResponseEntity<>(ruleService.createRule(rule, principal.getName()), HttpStatus.CREATED);
    }

    @PutMapping("/rules/{id}")
    public EscalationRule updateRule(@PathVariable Long id, @RequestBody EscalationRule rule) {
        return ruleService.updateRule(id, rule);
    }

    @DeleteMapping("/rules/{id}")
    public EscalationRule deactivateRule(@PathVariable Long id) {
        return ruleService.deactivateRule(id);
    }
}
