/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.querymetrics.core.bridge;

import dev.mars.querymetrics.api.events.QueryEvent;
import dev.mars.querymetrics.api.events.QueryEventListener;
import dev.mars.querymetrics.api.events.QueryEventSource;
import dev.mars.querymetrics.api.events.QueryEventType;
import dev.mars.querymetrics.core.metrics.QueryMetrics;
import dev.mars.querymetrics.core.tracker.CorrelationTracker;
import io.micrometer.core.instrument.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns query lifecycle events into metric updates.
 *
 * <p>Per correlation id the bridge follows {@code absent -> started -> (succeeded | failed)
 * -> absent}:</p>
 * <ul>
 *   <li>started: the start time is tracked</li>
 *   <li>succeeded: the elapsed time is observed into the duration histogram; skipped when
 *       the query was never seen starting</li>
 *   <li>failed: the error counter is incremented, whether or not the start was seen</li>
 * </ul>
 *
 * <p>Handlers never throw into the event source. After {@link #detach()} every event is
 * ignored, including events already queued by the source.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class QueryEventBridge {
    private static final Logger logger = LoggerFactory.getLogger(QueryEventBridge.class);

    private final CorrelationTracker tracker;
    private final QueryMetrics metrics;
    private final Clock clock;
    private final long staleEntryTimeoutNanos;

    private final QueryEventListener onStarted = this::handleStarted;
    private final QueryEventListener onSucceeded = this::handleSucceeded;
    private final QueryEventListener onFailed = this::handleFailed;

    private final AtomicBoolean detached = new AtomicBoolean(false);
    private final AtomicLong lastSweepNanos;
    private volatile QueryEventSource source;

    /**
     * @param tracker tracker of in-flight queries
     * @param metrics registered instruments to update
     * @param clock monotonic time source
     * @param staleEntryTimeout in-flight entries older than this are evicted; null disables eviction
     */
    public QueryEventBridge(CorrelationTracker tracker, QueryMetrics metrics, Clock clock, Duration staleEntryTimeout) {
        this.tracker = tracker;
        this.metrics = metrics;
        this.clock = clock;
        this.staleEntryTimeoutNanos = staleEntryTimeout != null ? staleEntryTimeout.toNanos() : -1L;
        this.lastSweepNanos = new AtomicLong(clock.monotonicTime());
    }

    /**
     * Subscribes to the three lifecycle channels of the source.
     *
     * @param eventSource the instrumented client
     * @return this bridge, whose {@link #detach()} undoes the subscription
     * @throws IllegalStateException if the bridge is already attached or was detached
     */
    public QueryEventBridge attach(QueryEventSource eventSource) {
        if (eventSource == null) {
            throw new IllegalArgumentException("eventSource must not be null");
        }
        if (detached.get() || source != null) {
            throw new IllegalStateException("Bridge can only be attached once");
        }
        this.source = eventSource;
        eventSource.subscribe(QueryEventType.QUERY_STARTED, onStarted);
        eventSource.subscribe(QueryEventType.QUERY_SUCCEEDED, onSucceeded);
        eventSource.subscribe(QueryEventType.QUERY_FAILED, onFailed);
        return this;
    }

    /**
     * Unsubscribes from the source. Safe to call more than once and while events are being
     * delivered; an event already being handled may still complete.
     */
    public void detach() {
        if (!detached.compareAndSet(false, true)) {
            return;
        }
        QueryEventSource current = source;
        if (current != null) {
            current.unsubscribe(QueryEventType.QUERY_STARTED, onStarted);
            current.unsubscribe(QueryEventType.QUERY_SUCCEEDED, onSucceeded);
            current.unsubscribe(QueryEventType.QUERY_FAILED, onFailed);
        }
        int pending = tracker.size();
        tracker.clear();
        logger.info("Query metrics detached ({} in-flight queries discarded)", pending);
    }

    public boolean isDetached() {
        return detached.get();
    }

    public int inFlightQueries() {
        return tracker.size();
    }

    void handleStarted(QueryEvent event) {
        if (detached.get()) {
            return;
        }
        try {
            String id = correlationId(event, QueryEventType.QUERY_STARTED);
            if (id == null) {
                return;
            }
            long now = clock.monotonicTime();
            tracker.recordStart(id, now);
            sweepIfDue(now);
        } catch (RuntimeException e) {
            logger.warn("Failed to handle '{}' event, skipping it", QueryEventType.QUERY_STARTED.channel(), e);
        }
    }

    void handleSucceeded(QueryEvent event) {
        if (detached.get()) {
            return;
        }
        try {
            String id = correlationId(event, QueryEventType.QUERY_SUCCEEDED);
            if (id == null) {
                return;
            }
            OptionalLong start = tracker.takeAndRemove(id);
            if (start.isEmpty()) {
                logger.debug("Response for untracked query {}, no duration recorded", id);
                return;
            }
            long elapsedNanos = clock.monotonicTime() - start.getAsLong();
            metrics.observeDurationNanos(elapsedNanos);
        } catch (RuntimeException e) {
            logger.warn("Failed to handle '{}' event, skipping it", QueryEventType.QUERY_SUCCEEDED.channel(), e);
        }
    }

    void handleFailed(QueryEvent event) {
        if (detached.get()) {
            return;
        }
        try {
            if (event == null) {
                logger.debug("Ignoring null '{}' event", QueryEventType.QUERY_FAILED.channel());
                return;
            }
            if (event.correlationId() != null) {
                tracker.takeAndRemove(event.correlationId());
            }
            // A failure is counted even without a matching start
            metrics.countError(event.errorMessage());
        } catch (RuntimeException e) {
            logger.warn("Failed to handle '{}' event, skipping it", QueryEventType.QUERY_FAILED.channel(), e);
        }
    }

    private static String correlationId(QueryEvent event, QueryEventType type) {
        if (event == null || event.correlationId() == null) {
            logger.debug("Ignoring '{}' event without a correlation id", type.channel());
            return null;
        }
        return event.correlationId();
    }

    private void sweepIfDue(long now) {
        if (staleEntryTimeoutNanos <= 0) {
            return;
        }
        long last = lastSweepNanos.get();
        if (now - last >= staleEntryTimeoutNanos && lastSweepNanos.compareAndSet(last, now)) {
            int evicted = tracker.evictOlderThan(now - staleEntryTimeoutNanos);
            if (evicted > 0) {
                logger.debug("Evicted {} queries older than {} ms", evicted,
                    TimeUnit.NANOSECONDS.toMillis(staleEntryTimeoutNanos));
            }
        }
    }
}
