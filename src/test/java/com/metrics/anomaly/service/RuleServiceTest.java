package com.metrics.anomaly.service;

import com.metrics.anomaly.engine.AlertRuleEngine;
import com.metrics.anomaly.escalation.EscalationScheduler;
import com.metrics.anomaly.exception.UnknownRuleException;
import com.metrics.anomaly.model.AlertRule;
import com.metrics.anomaly.model.AlertRuleUpdate;
import com.metrics.anomaly.model.Severity;
import com.metrics.anomaly.model.ThrottlePolicy;
import com.metrics.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.metrics.anomaly.throttle.ThrottleController;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleServiceTest {

    @Mock
    private AlertRuleEngine ruleEngine;

    @Mock
    private ThrottleController throttleController;

    @Mock
    private EscalationScheduler escalationScheduler;

    @InjectMocks
    private RuleService ruleService;

    @Test
    void getAllRules_delegatesToEngine() {
        when(ruleEngine.listRules()).thenReturn(List.of(TestDataFactory.createErrorRateRule("R1")));

        assertThat(ruleService.getAllRules()).extracting(AlertRule::getId).containsExactly("R1");
    }

    @Test
    void createRule_missingId_generatesOne() {
        AlertRule rule = TestDataFactory.createErrorRateRule(null);

        AlertRule created = ruleService.createRule(rule);

        assertThat(created.getId()).isNotBlank();
        verify(ruleEngine).addRule(created);
    }

    @Test
    void createRule_keepsGivenId() {
        AlertRule created = ruleService.createRule(TestDataFactory.createErrorRateRule("R1"));

        assertThat(created.getId()).isEqualTo("R1");
    }

    @Test
    void updateRule_mergesOnlyProvidedFields() {
        AlertRule existing = TestDataFactory.createErrorRateRule("R1");
        when(ruleEngine.getRule("R1")).thenReturn(existing);
        AlertRuleUpdate patch = AlertRuleUpdate.builder()
                .severity(Severity.CRITICAL)
                .throttle(new ThrottlePolicy(10, 2))
                .enabled(false)
                .build();

        AlertRule merged = ruleService.updateRule("R1", patch);

        assertThat(merged.getId()).isEqualTo("R1");
        assertThat(merged.getName()).isEqualTo(existing.getName());
        assertThat(merged.getCondition()).isEqualTo(existing.getCondition());
        assertThat(merged.getChannels()).isEqualTo(existing.getChannels());
        assertThat(merged.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(merged.getThrottle().getMaxAlerts()).isEqualTo(2);
        assertThat(merged.isEnabled()).isFalse();
        ArgumentCaptor<AlertRule> captor = ArgumentCaptor.forClass(AlertRule.class);
        verify(ruleEngine).addRule(captor.capture());
        assertThat(captor.getValue()).isSameAs(merged);
    }

    @Test
    void updateRule_renameOnly_keepsDisabledRuleDisabled() {
        AlertRule existing = TestDataFactory.createErrorRateRule("R1");
        existing.setEnabled(false);
        when(ruleEngine.getRule("R1")).thenReturn(existing);

        AlertRule merged = ruleService.updateRule("R1", AlertRuleUpdate.builder().name("renamed").build());

        assertThat(merged.getName()).isEqualTo("renamed");
        assertThat(merged.isEnabled()).isFalse();
    }

    @Test
    void updateRule_explicitEnable_reEnablesRule() {
        AlertRule existing = TestDataFactory.createErrorRateRule("R1");
        existing.setEnabled(false);
        when(ruleEngine.getRule("R1")).thenReturn(existing);

        AlertRule merged = ruleService.updateRule("R1", AlertRuleUpdate.builder().enabled(true).build());

        assertThat(merged.isEnabled()).isTrue();
    }

    @Test
    void updateRule_unknownRule_throws() {
        when(ruleEngine.getRule("missing")).thenThrow(new UnknownRuleException("missing"));

        assertThatThrownBy(() -> ruleService.updateRule("missing", new AlertRuleUpdate()))
                .isInstanceOf(UnknownRuleException.class);
        verify(ruleEngine, never()).addRule(any());
    }

    @Test
    void deleteRule_cancelsEscalationsAndResetsThrottle() {
        when(ruleEngine.removeRule("R1")).thenReturn(true);
        when(escalationScheduler.cancelForRule("R1")).thenReturn(2);

        assertThat(ruleService.deleteRule("R1")).isTrue();

        verify(escalationScheduler).cancelForRule("R1");
        verify(throttleController).reset("R1");
    }

    @Test
    void deleteRule_unknownRule_returnsFalse() {
        when(ruleEngine.removeRule("missing")).thenReturn(false);

        assertThat(ruleService.deleteRule("missing")).isFalse();
    }
}
