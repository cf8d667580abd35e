package com.phillippitts.surveyprogress.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics tracking for survey progress commands.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Sessions started</li>
 *   <li>Commands processed and failed, per command type</li>
 *   <li>Stale commands dropped because their session is no longer active</li>
 *   <li>Submissions rejected before reaching a worker</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class ProgressMetrics {

    private static final String METRIC_PREFIX = "survey.progress";

    private final MeterRegistry registry;

    public ProgressMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementSessionsStarted() {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Number of survey sessions started")
                .register(registry)
                .increment();
    }

    /**
     * Increments the processed counter for a command type.
     *
     * @param command command name (e.g. ReceiveQuestionList)
     */
    public void incrementProcessed(String command) {
        Counter.builder(METRIC_PREFIX + ".commands.processed")
                .description("Number of commands applied to session state")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for a command type.
     *
     * @param command command name
     * @param reason  exception simple name
     */
    public void incrementFailed(String command, String reason) {
        Counter.builder(METRIC_PREFIX + ".commands.failed")
                .description("Number of commands whose processing failed")
                .tag("command", command)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementStale(String command) {
        Counter.builder(METRIC_PREFIX + ".commands.stale")
                .description("Number of commands dropped because their session is no longer active")
                .tag("command", command)
                .register(registry)
                .increment();
    }

    public void incrementRejected(String command) {
        Counter.builder(METRIC_PREFIX + ".commands.rejected")
                .description("Number of commands that could not be enqueued")
                .tag("command", command)
                .register(registry)
                .increment();
    }
}
