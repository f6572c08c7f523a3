package com.metrics.anomaly.throttle;

import com.metrics.anomaly.model.ThrottlePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window rate limiter keyed by rule id.
 *
 * The first send opens a window at that instant. Within a window up to {@code maxAlerts} sends
 * are allowed; once {@code durationMinutes} have elapsed since the window opened, the next
 * attempt opens a fresh window. Attempts for the same rule are serialized.
 */
@Component
public class ThrottleController {

    private static final Logger log = LoggerFactory.getLogger(ThrottleController.class);

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    /**
     * Decide whether a firing of {@code ruleId} may be sent now, recording the send if so.
     * A null policy never throttles.
     */
    public boolean tryAcquire(String ruleId, ThrottlePolicy policy, long now) {
        if (policy == null) {
            return true;
        }
        Window window = windows.computeIfAbsent(ruleId, id -> new Window());
        synchronized (window) {
            if (!window.started) {
                window.open(now);
                return true;
            }
            if (now - window.start >= policy.durationMs()) {
                log.debug("Throttle window for rule {} reset after {} ms", ruleId, now - window.start);
                window.open(now);
                return true;
            }
            if (window.count < policy.getMaxAlerts()) {
                window.count++;
                return true;
            }
            log.debug("Rule {} throttled: {} of {} alerts sent since {}",
                    ruleId, window.count, policy.getMaxAlerts(), window.start);
            return false;
        }
    }

    public void reset(String ruleId) {
        if (windows.remove(ruleId) != null) {
            log.debug("Throttle state cleared for rule {}", ruleId);
        }
    }

    public Optional<ThrottleState> state(String ruleId) {
        Window window = windows.get(ruleId);
        if (window == null) {
            return Optional.empty();
        }
        synchronized (window) {
            return window.started
                    ? Optional.of(new ThrottleState(ruleId, window.start, window.count))
                    : Optional.empty();
        }
    }

    private static final class Window {
        private boolean started;
        private long start;
        private int count;

        private void open(long now) {
            started = true;
            start = now;
            count = 1;
        }
    }
}
