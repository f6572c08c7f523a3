package com.metrics.anomaly.service;

import com.metrics.anomaly.engine.AlertRuleEngine;
import com.metrics.anomaly.escalation.EscalationScheduler;
import com.metrics.anomaly.exception.UnknownRuleException;
import com.metrics.anomaly.model.AlertRule;
import com.metrics.anomaly.model.AlertRuleUpdate;
import com.metrics.anomaly.throttle.ThrottleController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service layer for managing alert rules.
 * Removing a rule also drops its pending escalations and throttle window.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final AlertRuleEngine ruleEngine;
    private final ThrottleController throttleController;
    private final EscalationScheduler escalationScheduler;

    public RuleService(AlertRuleEngine ruleEngine, ThrottleController throttleController,
                       EscalationScheduler escalationScheduler) {
        this.ruleEngine = ruleEngine;
        this.throttleController = throttleController;
        this.escalationScheduler = escalationScheduler;
    }

    public List<AlertRule> getAllRules() {
        return ruleEngine.listRules();
    }

    public AlertRule getRule(String ruleId) {
        return ruleEngine.getRule(ruleId);
    }

    /**
     * Add a rule, replacing any existing rule with the same id. A missing id is generated.
     */
    public AlertRule createRule(AlertRule rule) {
        if (rule.getId() == null || rule.getId().isEmpty()) {
            rule.setId(UUID.randomUUID().toString());
        }
        ruleEngine.addRule(rule);
        return rule;
    }

    /**
     * Merge the non-null fields of {@code updated} into the existing rule.
     *
     * @throws UnknownRuleException if no rule has this id
     */
    public AlertRule updateRule(String ruleId, AlertRuleUpdate updated) {
        AlertRule existing = ruleEngine.getRule(ruleId);

        AlertRule merged = existing.toBuilder().build();
        merged.setChannels(new ArrayList<>(existing.getChannels()));
        if (updated.getName() != null) merged.setName(updated.getName());
        if (updated.getDescription() != null) merged.setDescription(updated.getDescription());
        if (updated.getCondition() != null) merged.setCondition(updated.getCondition());
        if (updated.getSeverity() != null) merged.setSeverity(updated.getSeverity());
        if (updated.getChannels() != null) merged.setChannels(updated.getChannels());
        if (updated.getThrottle() != null) merged.setThrottle(updated.getThrottle());
        if (updated.getEscalation() != null) merged.setEscalation(updated.getEscalation());
        if (updated.getEnabled() != null) merged.setEnabled(updated.getEnabled());

        ruleEngine.addRule(merged);
        return merged;
    }

    public boolean deleteRule(String ruleId) {
        boolean removed = ruleEngine.removeRule(ruleId);
        int cancelled = escalationScheduler.cancelForRule(ruleId);
        throttleController.reset(ruleId);
        if (removed) {
            log.info("Rule {} deleted ({} pending escalation(s) cancelled)", ruleId, cancelled);
        }
        return removed;
    }
}
