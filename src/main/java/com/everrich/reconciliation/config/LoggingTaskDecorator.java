package com.everrich.reconciliation.config;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * Carries the submitting thread's MDC into async tasks and logs how long each one ran.
 */
public class LoggingTaskDecorator implements TaskDecorator {

    private static final Logger log = LoggerFactory.getLogger(LoggingTaskDecorator.class);

    @Override
    public Runnable decorate(Runnable runnable) {
        String submissionThreadName = Thread.currentThread().getName();
        Map<String, String> context = MDC.getCopyOfContextMap();

        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            Instant startTime = Instant.now();
            log.debug(">>> async task start | thread: {} | submitted by: {}",
                    Thread.currentThread().getName(), submissionThreadName);
            try {
                runnable.run();
            } finally {
                log.debug("<<< async task finish | thread: {} | duration: {} ms",
                        Thread.currentThread().getName(), Duration.between(startTime, Instant.now()).toMillis());
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
