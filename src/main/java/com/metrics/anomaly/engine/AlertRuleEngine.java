package com.metrics.anomaly.engine;

import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.exception.InvalidRuleException;
import com.metrics.anomaly.exception.UnknownRuleException;
import com.metrics.anomaly.model.AlertCondition;
import com.metrics.anomaly.model.AlertRule;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.EscalationPolicy;
import com.metrics.anomaly.model.Severity;
import com.metrics.anomaly.model.ThrottlePolicy;
import com.metrics.anomaly.store.MetricWindowStore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the alert rules and evaluates them against windowed aggregates.
 *
 * Evaluation is read-only: it neither mutates the store nor the throttle. A metric with no
 * samples in a rule's window never fires, whatever the operator.
 */
@Component
public class AlertRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleEngine.class);

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final MetricWindowStore store;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AlertRuleEngine(MetricWindowStore store, Tracer tracer, MetricsConfig metricsConfig) {
        this.store = store;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Register a rule, replacing any rule with the same id.
     *
     * @return the previous rule with that id, or null
     * @throws InvalidRuleException if the rule is malformed
     */
    public AlertRule addRule(AlertRule rule) {
        validate(rule);
        if (rule.getSeverity() == null) {
            rule.setSeverity(Severity.MEDIUM);
        }
        if (rule.getName() == null || rule.getName().isBlank()) {
            rule.setName(rule.getId());
        }
        if (rule.getChannels() == null) {
            rule.setChannels(new ArrayList<>());
        }
        AlertRule previous = rules.put(rule.getId(), rule);
        log.info("{} rule {} ({} {} {} over {}m {})", previous == null ? "Added" : "Replaced",
                rule.getId(), rule.getCondition().getMetric(), rule.getCondition().getOperator(),
                rule.getCondition().getThreshold(), rule.getCondition().getWindowMinutes(),
                rule.getCondition().getAggregation());
        return previous;
    }

    /**
     * Idempotent.
     *
     * @return true if a rule was removed
     */
    public boolean removeRule(String ruleId) {
        AlertRule removed = ruleId == null ? null : rules.remove(ruleId);
        if (removed != null) {
            log.info("Removed rule {}", ruleId);
        }
        return removed != null;
    }

    public List<AlertRule> listRules() {
        List<AlertRule> all = new ArrayList<>(rules.values());
        all.sort(Comparator.comparing(AlertRule::getId));
        return all;
    }

    public AlertRule getRule(String ruleId) {
        AlertRule rule = ruleId == null ? null : rules.get(ruleId);
        if (rule == null) {
            throw new UnknownRuleException(ruleId);
        }
        return rule;
    }

    public boolean hasRule(String ruleId) {
        return ruleId != null && rules.containsKey(ruleId);
    }

    /**
     * Evaluate all enabled rules.
     *
     * @param now evaluation time in epoch milliseconds
     * @return the rules whose condition held, in rule id order
     */
    @Observed(name = "rules.evaluate_all", contextualName = "evaluate-all-rules")
    public List<RuleFiring> evaluate(long now) {
        List<RuleFiring> fired = new ArrayList<>();

        for (AlertRule rule : listRules()) {
            if (!rule.isEnabled()) {
                continue;
            }

            AlertCondition condition = rule.getCondition();
            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate")
                    .tag("rule.id", rule.getId())
                    .tag("rule.metric", condition.getMetric())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                OptionalDouble aggregate = aggregate(rule, now);
                if (aggregate.isEmpty()) {
                    ruleSpan.tag("rule.fired", "false");
                    ruleSpan.tag("rule.no_data", "true");
                    log.debug("Rule {}: no data for {} in last {}m",
                            rule.getId(), condition.getMetric(), condition.getWindowMinutes());
                    continue;
                }

                double value = aggregate.getAsDouble();
                boolean matches = condition.matches(value);
                ruleSpan.tag("rule.fired", String.valueOf(matches));
                ruleSpan.tag("rule.aggregate", String.valueOf(value));

                if (matches) {
                    fired.add(new RuleFiring(rule, value, now));
                    metricsConfig.recordRuleFired(rule.getSeverity().toValue());
                    log.debug("Rule fired: {} {}({}) over {}m = {} {} {}",
                            rule.getId(), condition.getAggregation().toValue(), condition.getMetric(),
                            condition.getWindowMinutes(), value,
                            condition.getOperator().getSymbol(), condition.getThreshold());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                metricsConfig.recordRuleEvaluationFailure();
                log.error("Error evaluating rule {}: {}", rule.getId(), e.getMessage(), e);
                // One bad rule must not block the rest of the cycle
            } finally {
                ruleSpan.end();
            }
        }

        return fired;
    }

    /**
     * Re-check a single rule. Unknown, disabled and no-data rules are not firing.
     */
    public boolean isFiring(String ruleId, long now) {
        AlertRule rule = ruleId == null ? null : rules.get(ruleId);
        if (rule == null || !rule.isEnabled()) {
            return false;
        }
        try {
            OptionalDouble aggregate = aggregate(rule, now);
            return aggregate.isPresent() && rule.getCondition().matches(aggregate.getAsDouble());
        } catch (Exception e) {
            log.error("Error re-checking rule {}: {}", ruleId, e.getMessage(), e);
            return false;
        }
    }

    private OptionalDouble aggregate(AlertRule rule, long now) {
        AlertCondition condition = rule.getCondition();
        return store.aggregate(condition.getMetric(), condition.getWindowMinutes(),
                condition.getAggregation(), now);
    }

    static void validate(AlertRule rule) {
        if (rule == null) {
            throw new InvalidRuleException("Rule must not be null");
        }
        if (rule.getId() == null || rule.getId().isBlank()) {
            throw new InvalidRuleException("Rule id must not be empty");
        }
        AlertCondition condition = rule.getCondition();
        if (condition == null) {
            throw new InvalidRuleException("Rule " + rule.getId() + " has no condition");
        }
        if (condition.getMetric() == null || condition.getMetric().isBlank()) {
            throw new InvalidRuleException("Rule " + rule.getId() + " condition has no metric");
        }
        if (condition.getOperator() == null) {
            throw new InvalidRuleException("Rule " + rule.getId() + " condition has no operator");
        }
        if (condition.getAggregation() == null) {
            throw new InvalidRuleException("Rule " + rule.getId() + " condition has no aggregation");
        }
        if (condition.getWindowMinutes() <= 0) {
            throw new InvalidRuleException("Rule " + rule.getId()
                    + " windowMinutes must be > 0, got: " + condition.getWindowMinutes());
        }
        if (!Double.isFinite(condition.getThreshold())) {
            throw new InvalidRuleException("Rule " + rule.getId() + " threshold must be finite");
        }
        validateChannels(rule.getId(), rule.getChannels());

        ThrottlePolicy throttle = rule.getThrottle();
        if (throttle != null && (throttle.getDurationMinutes() <= 0 || throttle.getMaxAlerts() <= 0)) {
            throw new InvalidRuleException("Rule " + rule.getId()
                    + " throttle needs durationMinutes > 0 and maxAlerts > 0");
        }

        EscalationPolicy escalation = rule.getEscalation();
        if (escalation != null) {
            if (escalation.getDelayMinutes() < 0) {
                throw new InvalidRuleException("Rule " + rule.getId() + " escalation delayMinutes must be >= 0");
            }
            if (escalation.getChannels() == null || escalation.getChannels().isEmpty()) {
                throw new InvalidRuleException("Rule " + rule.getId() + " escalation needs at least one channel");
            }
            validateChannels(rule.getId(), escalation.getChannels());
        }
    }

    private static void validateChannels(String ruleId, List<ChannelConfig> channels) {
        if (channels == null) {
            return;
        }
        for (ChannelConfig channel : channels) {
            if (channel == null || channel.getType() == null) {
                throw new InvalidRuleException("Rule " + ruleId + " has a channel without a type");
            }
        }
    }
}
