package com.metrics.anomaly.escalation;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.engine.AlertRuleEngine;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.EscalationMode;
import com.metrics.anomaly.model.EscalationPolicy;
import com.metrics.anomaly.model.EscalationTask;
import com.metrics.anomaly.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-ordered queue of deferred escalations.
 *
 * Tasks sit in a min-heap keyed by due time and are drained by a fixed-delay poller. Cancelled
 * tasks are removed from the heap immediately, so the heap only ever holds live tasks.
 */
@Component
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private static final Comparator<EscalationTask> BY_FIRE_AT =
            Comparator.comparingLong(EscalationTask::getFireAt).thenComparing(EscalationTask::getAlertId);

    private final PriorityQueue<EscalationTask> queue = new PriorityQueue<>(BY_FIRE_AT);
    private final Map<String, EscalationTask> byAlertId = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final NotificationDispatcher dispatcher;
    private final AlertRuleEngine ruleEngine;
    private final AlertingConfig.Escalation config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public EscalationScheduler(NotificationDispatcher dispatcher, AlertRuleEngine ruleEngine,
                               AlertingConfig alertingConfig, MetricsConfig metricsConfig, Clock clock) {
        this.dispatcher = dispatcher;
        this.ruleEngine = ruleEngine;
        this.config = alertingConfig.getEscalation();
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Queue an escalation due {@code policy.delayMinutes} after the original dispatch.
     * A task already queued for the same alert id is replaced.
     */
    public EscalationTask schedule(Alert alert, EscalationPolicy policy, long dispatchedAt) {
        return schedule(new EscalationTask(alert.getId(), alert.getRuleId(),
                dispatchedAt + policy.delayMs(), List.copyOf(policy.getChannels()), alert));
    }

    public EscalationTask schedule(EscalationTask task) {
        lock.lock();
        try {
            EscalationTask previous = byAlertId.put(task.getAlertId(), task);
            if (previous != null) {
                queue.remove(previous);
            }
            queue.add(task);
            metricsConfig.updatePendingEscalations(queue.size());
        } finally {
            lock.unlock();
        }
        metricsConfig.recordEscalation("scheduled");
        log.info("Escalation scheduled for alert {} (rule {}) at {}",
                task.getAlertId(), task.getRuleId(), task.getFireAt());
        return task;
    }

    /**
     * @return true if a pending task was removed
     */
    public boolean cancel(String alertId) {
        EscalationTask removed;
        lock.lock();
        try {
            removed = byAlertId.remove(alertId);
            if (removed != null) {
                queue.remove(removed);
                metricsConfig.updatePendingEscalations(queue.size());
            }
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            metricsConfig.recordEscalation("cancelled");
            log.info("Escalation cancelled for alert {}", alertId);
        }
        return removed != null;
    }

    /**
     * Cancel every pending escalation raised by a rule.
     *
     * @return number of tasks removed
     */
    public int cancelForRule(String ruleId) {
        List<EscalationTask> removed = new ArrayList<>();
        lock.lock();
        try {
            queue.removeIf(task -> {
                if (task.getRuleId().equals(ruleId)) {
                    removed.add(task);
                    return true;
                }
                return false;
            });
            removed.forEach(task -> byAlertId.remove(task.getAlertId()));
            metricsConfig.updatePendingEscalations(queue.size());
        } finally {
            lock.unlock();
        }
        if (!removed.isEmpty()) {
            removed.forEach(task -> metricsConfig.recordEscalation("cancelled"));
            log.info("Cancelled {} pending escalation(s) for rule {}", removed.size(), ruleId);
        }
        return removed.size();
    }

    /**
     * Pending tasks ordered by due time.
     */
    public List<EscalationTask> pending() {
        lock.lock();
        try {
            List<EscalationTask> tasks = new ArrayList<>(queue);
            tasks.sort(BY_FIRE_AT);
            return tasks;
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${alerting.escalation.poll-interval-ms:1000}")
    public void poll() {
        runDue(clock.millis());
    }

    /**
     * Remove and send every task due at {@code now}. Dispatch is asynchronous; this never blocks
     * on channel delivery.
     *
     * @return the tasks that were due
     */
    public List<EscalationTask> runDue(long now) {
        List<EscalationTask> due = new ArrayList<>();
        lock.lock();
        try {
            while (!queue.isEmpty() && queue.peek().getFireAt() <= now) {
                EscalationTask task = queue.poll();
                byAlertId.remove(task.getAlertId());
                due.add(task);
            }
            if (!due.isEmpty()) {
                metricsConfig.updatePendingEscalations(queue.size());
            }
        } finally {
            lock.unlock();
        }

        for (EscalationTask task : due) {
            fire(task, now);
        }
        return due;
    }

    private void fire(EscalationTask task, long now) {
        if (config.getMode() == EscalationMode.ESCALATE_IF_STILL_FIRING
                && !ruleEngine.isFiring(task.getRuleId(), now)) {
            metricsConfig.recordEscalation("skipped");
            log.info("Escalation for alert {} skipped: rule {} no longer firing",
                    task.getAlertId(), task.getRuleId());
            return;
        }

        Alert original = task.getAlert();
        Alert escalated = original.toBuilder()
                .id(UUID.randomUUID().toString())
                .message(config.getMessagePrefix() + original.getMessage())
                .timestamp(now)
                .escalation(true)
                .build();

        metricsConfig.recordEscalation("sent");
        log.warn("Escalating alert {} (rule {}) to {} channel(s)",
                task.getAlertId(), task.getRuleId(), task.getChannels().size());

        dispatcher.dispatch(escalated, task.getChannels())
                .thenAccept(report -> {
                    if (!report.anySucceeded()) {
                        log.error("Escalation for alert {} failed on all {} channel(s)",
                                task.getAlertId(), report.getResults().size());
                    }
                });
    }
}
