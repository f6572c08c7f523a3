package com.metrics.anomaly.notification;

import com.metrics.anomaly.config.AlertingConfig;
import com.metrics.anomaly.config.MetricsConfig;
import com.metrics.anomaly.exception.DispatchException;
import com.metrics.anomaly.model.Alert;
import com.metrics.anomaly.model.ChannelConfig;
import com.metrics.anomaly.model.ChannelResult;
import com.metrics.anomaly.model.ChannelType;
import com.metrics.anomaly.model.DispatchReport;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans an alert out to its channels.
 *
 * Each channel is attempted independently on the dispatch pool with its own timeout. A timeout,
 * exception or pool rejection on one channel becomes a failed {@link ChannelResult} and never
 * affects the other channels. Nothing here blocks the caller.
 */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);
    private final Executor executor;
    private final long timeoutMs;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  @Qualifier("dispatchExecutor") Executor executor,
                                  AlertingConfig alertingConfig,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.executor = executor;
        this.timeoutMs = alertingConfig.getDispatch().getChannelTimeoutMs();
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        // Auto-register all channel implementations
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.type(), channel);
            log.info("Registered notification channel: {} -> {}",
                    channel.type().toValue(), channel.getClass().getSimpleName());
        }
    }

    @Observed(name = "notification.dispatch", contextualName = "dispatch-alert")
    public CompletableFuture<DispatchReport> dispatch(Alert alert, List<ChannelConfig> targets) {
        List<CompletableFuture<ChannelResult>> attempts = new ArrayList<>();
        for (ChannelConfig target : targets) {
            attempts.add(attempt(alert, target));
        }

        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<ChannelResult> results = attempts.stream().map(CompletableFuture::join).toList();
                    DispatchReport report = new DispatchReport(alert.getId(), results, clock.millis());
                    log.info("Alert {} dispatched: {} of {} channel(s) succeeded",
                            alert.getId(), results.size() - report.failureCount(), results.size());
                    return report;
                });
    }

    private CompletableFuture<ChannelResult> attempt(Alert alert, ChannelConfig target) {
        ChannelType type = target.getType();
        NotificationChannel channel = type == null ? null : channels.get(type);
        if (channel == null) {
            return CompletableFuture.completedFuture(
                    record(alert, ChannelResult.failure(type, "No channel registered for type " + type, 0)));
        }

        long start = System.nanoTime();
        CompletableFuture<ChannelResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                try {
                    channel.send(alert, target);
                    return ChannelResult.success(type, elapsedMs(start));
                } catch (DispatchException e) {
                    throw new CompletionException(e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    record(alert, ChannelResult.failure(type, "Dispatch pool saturated", elapsedMs(start))));
        }

        return future
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> ChannelResult.failure(type, describe(e), elapsedMs(start)))
                .thenApply(result -> record(alert, result));
    }

    private ChannelResult record(Alert alert, ChannelResult result) {
        String channel = result.getChannelType() == null ? "unknown" : result.getChannelType().toValue();
        if (result.isSuccess()) {
            metricsConfig.recordNotification(channel, "success");
            log.debug("Alert {} delivered via {} in {} ms", alert.getId(), channel, result.getDurationMs());
        } else {
            metricsConfig.recordNotification(channel, "error");
            log.error("Alert {} failed on channel {}: {}", alert.getId(), channel, result.getError());
        }
        return result;
    }

    private String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            return "Timed out after " + timeoutMs + " ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
