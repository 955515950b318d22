package com.everrich.reconciliation.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.everrich.reconciliation.dto.SweepReport;

/**
 * Background trigger for the escalation sweep.
 */
@Component
public class EscalationSweeper {

    private static final Logger log = LoggerFactory.getLogger(EscalationSweeper.class);

    private final EscalationService escalationService;
    private final Clock clock;

    public EscalationSweeper(EscalationService escalationService, Clock clock) {
        this.escalationService = escalationService;
        this.clock = clock;
    }

    @Scheduled(cron = "${reconciliation.escalation.sweep-cron:0 0 * * * *}")
    public void runScheduledSweep() {
        SweepReport report = escalationService.sweep(LocalDateTime.now(clock));
        if (report.failed() > 0) {
            log.warn("Scheduled escalation sweep finished with {} failed cases", report.failed());
        }
    }
}
