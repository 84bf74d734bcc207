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
package dev.mars.querymetrics.core.tracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the correlation id of every in-flight query to the monotonic time its start event
 * was observed.
 *
 * <p>An entry is created on "query started" and consumed exactly once by whichever terminal
 * event arrives first. Per-id operations are atomic, so the tracker can be fed from several
 * threads.</p>
 *
 * <p>A query whose terminal event never arrives keeps its entry until
 * {@link #evictOlderThan(long)} removes it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class CorrelationTracker {
    private static final Logger logger = LoggerFactory.getLogger(CorrelationTracker.class);

    private final Map<String, Long> startTimes = new ConcurrentHashMap<>();

    /**
     * Records the start of a query.
     *
     * If the id is already tracked, the client reused it before the previous query finished;
     * the newer start time replaces the old one.
     *
     * @param correlationId the client-assigned query id
     * @param startNanos    monotonic start time in nanoseconds
     */
    public void recordStart(String correlationId, long startNanos) {
        Long previous = startTimes.put(correlationId, startNanos);
        if (previous != null) {
            logger.warn("Query {} started again before its previous run finished; restarting its timer",
                correlationId);
        }
    }

    /**
     * Reads and removes the start time of a query in one step.
     *
     * @param correlationId the client-assigned query id
     * @return the start time, or empty if the query is not tracked
     */
    public OptionalLong takeAndRemove(String correlationId) {
        Long startNanos = startTimes.remove(correlationId);
        return startNanos != null ? OptionalLong.of(startNanos) : OptionalLong.empty();
    }

    /**
     * Removes every entry that started before the cutoff.
     *
     * @param cutoffNanos monotonic time; entries with an earlier start are dropped
     * @return the number of entries removed
     */
    public int evictOlderThan(long cutoffNanos) {
        int evicted = 0;
        for (Map.Entry<String, Long> entry : startTimes.entrySet()) {
            // Monotonic timestamps may wrap, so compare by difference
            if (entry.getValue() - cutoffNanos < 0 && startTimes.remove(entry.getKey(), entry.getValue())) {
                evicted++;
                logger.debug("Evicted query {} with no terminal event", entry.getKey());
            }
        }
        return evicted;
    }

    public boolean contains(String correlationId) {
        return startTimes.containsKey(correlationId);
    }

    /**
     * Number of queries currently in flight.
     */
    public int size() {
        return startTimes.size();
    }

    public void clear() {
        startTimes.clear();
    }
}
