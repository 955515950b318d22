package com.everrich.reconciliation.controller;

import java.security.Principal;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.reconciliation.dto.SplitDecision;
import com.everrich.reconciliation.dto.SplitProposal;
import com.everrich.reconciliation.dto.SplitResult;
import com.everrich.reconciliation.dto.SplitSummary;
import com.everrich.reconciliation.entities.SplitType;
import com.everrich.reconciliation.exception.InvalidStateException;
import com.everrich.reconciliation.service.AllocationService;

@RestController
@RequestMapping("/api/splits")
public class SplitController {

    private static final Logger log = LoggerFactory.getLogger(SplitController.class);

    @Autowired
    private AllocationService allocationService;

    @PostMapping
    public ResponseEntity<SplitResult> propose(@RequestBody SplitProposal proposal, Principal principal) {
        log.info("REST call to propose split group {} ({})", proposal.groupId(), proposal.splitType());
        SplitResult result = allocationService.proposeSplit(proposal.withActor(principal.getName()));
        return new ResponseEntity<>(result, HttpStatus.CREATED);
    }

    @PutMapping("/{groupId}")
    public SplitResult revise(@PathVariable String groupId, @RequestBody SplitProposal proposal, Principal principal) {
        if (!groupId.equals(proposal.groupId())) {
            throw new InvalidStateException("Path group " + groupId + " does not match body group " + proposal.groupId());
        }
        return allocationService.reviseSplit(proposal.withActor(principal.getName()));
    }

    @PostMapping("/{groupId}/finalize")
    public SplitResult finalizeGroup(@PathVariable String groupId, Principal principal) {
        return allocationService.finalizeOrReject(groupId, SplitDecision.FINALIZE, principal.getName());
    }

    @PostMapping("/{groupId}/reject")
    public SplitResult rejectGroup(@PathVariable String groupId, Principal principal) {
        return allocationService.finalizeOrReject(groupId, SplitDecision.REJECT, principal.getName());
    }

    @GetMapping("/summary")
    public SplitSummary summary(@RequestParam String companyId) {
        return allocationService.summarize(companyId);
    }

    @GetMapping("/{groupId}")
    public SplitResult get(@PathVariable String groupId) {
        return allocationService.getSplitGroup(groupId);
    }

    @GetMapping
    public List<SplitResult> list(@RequestParam(required = false) SplitType type,
                                  @RequestParam(required = false) Boolean complete) {
        return allocationService.listSplitGroups(type, complete);
    }
}
