package com.metrics.anomaly.service;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.engine.AlertRuleEngine;
import com.metrics.anomaly.engine.RuleFiring;
import com.metrics.anomaly.escalation.EscalationScheduler;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.AlertCondition;
import com.metrics.anomaly.model.AlertRule;
import com.metrics.anomaly.model.DispatchReport;
import com.metrics.anomaly.model.MetricSample;
import com.metrics.anomaly.notification.NotificationDispatcher;
import com.metrics.anomaly.store.MetricWindowStore;
import com.metrics.anomaly.throttle.ThrottleController;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives the alert pipeline on every tick:
 * evaluate rules, gate each firing through its throttle, build the alert, dispatch it, and
 * queue an escalation once at least one channel has accepted it.
 */
@Service
public class AlertingService {

    private static final Logger log = LoggerFactory.getLogger(AlertingService.class);

    private final AlertRuleEngine ruleEngine;
    private final ThrottleController throttleController;
    private final NotificationDispatcher dispatcher;
    private final EscalationScheduler escalationScheduler;
    private final MetricWindowStore store;
    private final AlertingConfig alertingConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Deque<Alert> recentAlerts = new ArrayDeque<>();

    public AlertingService(AlertRuleEngine ruleEngine, ThrottleController throttleController,
                           NotificationDispatcher dispatcher, EscalationScheduler escalationScheduler,
                           MetricWindowStore store, AlertingConfig alertingConfig,
                           MetricsConfig metricsConfig, Clock clock) {
        this.ruleEngine = ruleEngine;
        this.throttleController = throttleController;
        this.dispatcher = dispatcher;
        this.escalationScheduler = escalationScheduler;
        this.store = store;
        this.alertingConfig = alertingConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${alerting.evaluation.tick-seconds:30}", timeUnit = TimeUnit.SECONDS)
    public void tick() {
        if (!alertingConfig.getEvaluation().isEnabled()) {
            return;
        }
        try {
            evaluateAt(clock.millis());
        } catch (Exception e) {
            // Keep the schedule alive; the next tick retries
            log.error("Evaluation cycle failed: {}", e.getMessage(), e);
        }
    }

    public CycleSummary evaluateNow() {
        return evaluateAt(clock.millis());
    }

    @Observed(name = "alerting.cycle", contextualName = "alerting-cycle")
    public CycleSummary evaluateAt(long now) {
        List<RuleFiring> firings = ruleEngine.evaluate(now);

        List<String> fired = new ArrayList<>();
        List<String> suppressed = new ArrayList<>();
        List<Alert> dispatched = new ArrayList<>();
        List<CompletableFuture<DispatchReport>> pending = new ArrayList<>();

        for (RuleFiring firing : firings) {
            AlertRule rule = firing.getRule();
            fired.add(rule.getId());

            if (!throttleController.tryAcquire(rule.getId(), rule.getThrottle(), now)) {
                suppressed.add(rule.getId());
                metricsConfig.recordAlertSuppressed(rule.getSeverity().toValue());
                log.debug("Alert for rule {} suppressed by throttle", rule.getId());
                continue;
            }

            Alert alert = buildAlert(firing, now);
            remember(alert);
            dispatched.add(alert);
            pending.add(dispatch(rule, alert));
        }

        if (!fired.isEmpty()) {
            log.info("Evaluation cycle at {}: {} fired, {} dispatched, {} suppressed",
                    now, fired.size(), dispatched.size(), suppressed.size());
        }
        return new CycleSummary(now, fired, dispatched, suppressed, pending);
    }

    private CompletableFuture<DispatchReport> dispatch(AlertRule rule, Alert alert) {
        return dispatcher.dispatch(alert, rule.getChannels())
                .thenApply(report -> {
                    if (rule.getEscalation() != null) {
                        if (!report.anySucceeded()) {
                            log.warn("Alert {} not delivered on any channel; escalation not scheduled", alert.getId());
                        } else if (!ruleEngine.hasRule(rule.getId())) {
                            log.debug("Rule {} removed before dispatch completed; escalation not scheduled", rule.getId());
                        } else {
                            escalationScheduler.schedule(alert, rule.getEscalation(), alert.getTimestamp());
                        }
                    }
                    return report;
                });
    }

    private Alert buildAlert(RuleFiring firing, long now) {
        AlertRule rule = firing.getRule();
        AlertCondition condition = rule.getCondition();
        List<Double> values = store.window(condition.getMetric(), condition.getWindowMinutes(), now).stream()
                .map(MetricSample::getValue)
                .toList();

        String message = String.format("[%s] %s: %s(%s) over %dm = %.4f %s %.4f",
                rule.getSeverity().name(), rule.getName(),
                condition.getAggregation().toValue(), condition.getMetric(), condition.getWindowMinutes(),
                firing.getAggregateValue(), condition.getOperator().getSymbol(), condition.getThreshold());

        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .severity(rule.getSeverity())
                .message(message)
                .timestamp(now)
                .metric(condition.getMetric())
                .aggregateValue(firing.getAggregateValue())
                .values(values)
                .correlationId(UUID.randomUUID().toString())
                .escalation(false)
                .build();
    }

    private void remember(Alert alert) {
        synchronized (recentAlerts) {
            recentAlerts.addFirst(alert);
            while (recentAlerts.size() > alertingConfig.getRecentAlertCapacity()) {
                recentAlerts.removeLast();
            }
        }
    }

    /**
     * Most recent alerts first.
     */
    public List<Alert> recentAlerts(int limit) {
        synchronized (recentAlerts) {
            return recentAlerts.stream().limit(Math.max(0, limit)).toList();
        }
    }
}
