package com.metrics.anomaly.store;

import com.metrics.anomaly.exception.InvalidSampleException;
import com.metrics.anomaly.model.MetricSample;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, time-ordered history of one metric.
 *
 * Timestamps are strictly increasing. The oldest samples are evicted first once the
 * window holds more than {@code maxSamples} entries or once a sample is older than
 * {@code maxAgeMs} relative to the newest one. Readers always receive a copy.
 */
public class MetricWindow {

    private final String metricName;
    private final int maxSamples;
    private final long maxAgeMs;

    private final Deque<MetricSample> samples = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public MetricWindow(String metricName, int maxSamples, long maxAgeMs) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0, got: " + maxSamples);
        }
        this.metricName = metricName;
        this.maxSamples = maxSamples;
        this.maxAgeMs = maxAgeMs;
    }

    public void append(MetricSample sample) {
        lock.writeLock().lock();
        try {
            MetricSample last = samples.peekLast();
            if (last != null && sample.getTimestamp() <= last.getTimestamp()) {
                throw new InvalidSampleException(metricName, String.format(
                        "Out-of-order timestamp for metric '%s': %d is not after last sample at %d",
                        metricName, sample.getTimestamp(), last.getTimestamp()));
            }
            samples.addLast(sample);
            evict(sample.getTimestamp());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void evict(long newestTimestamp) {
        while (samples.size() > maxSamples) {
            samples.pollFirst();
        }
        if (maxAgeMs > 0) {
            long cutoff = newestTimestamp - maxAgeMs;
            while (!samples.isEmpty() && samples.peekFirst().getTimestamp() < cutoff) {
                samples.pollFirst();
            }
        }
    }

    /**
     * Up to {@code count} most recent samples, oldest first.
     */
    public List<MetricSample> recent(int count) {
        if (count <= 0) {
            return Collections.emptyList();
        }
        lock.readLock().lock();
        try {
            List<MetricSample> result = new ArrayList<>(Math.min(count, samples.size()));
            Iterator<MetricSample> it = samples.descendingIterator();
            while (it.hasNext() && result.size() < count) {
                result.add(it.next());
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Samples with {@code timestamp >= fromTimestamp}, oldest first.
     */
    public List<MetricSample> since(long fromTimestamp) {
        lock.readLock().lock();
        try {
            List<MetricSample> result = new ArrayList<>();
            Iterator<MetricSample> it = samples.descendingIterator();
            while (it.hasNext()) {
                MetricSample sample = it.next();
                if (sample.getTimestamp() < fromTimestamp) {
                    break;
                }
                result.add(sample);
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return samples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getMetricName() {
        return metricName;
    }
}
