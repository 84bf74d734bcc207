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
package dev.mars.querymetrics.core.metrics;

import dev.mars.querymetrics.api.QueryExporterOptions;
import dev.mars.querymetrics.api.metrics.CounterInstrument;
import dev.mars.querymetrics.api.metrics.CounterSpec;
import dev.mars.querymetrics.api.metrics.HistogramInstrument;
import dev.mars.querymetrics.api.metrics.HistogramSpec;
import dev.mars.querymetrics.api.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The query duration histogram and query error counter of one instrumented client.
 *
 * Both instruments are created and registered once, in {@link #initialize}, and live as
 * long as the exporter. Their values only ever grow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public final class QueryMetrics {
    private static final Logger logger = LoggerFactory.getLogger(QueryMetrics.class);

    private final HistogramInstrument durationHistogram;
    private final CounterInstrument errorCounter;
    private final boolean includeErrorMessageLabel;

    private QueryMetrics(HistogramInstrument durationHistogram, CounterInstrument errorCounter,
                         boolean includeErrorMessageLabel) {
        this.durationHistogram = durationHistogram;
        this.errorCounter = errorCounter;
        this.includeErrorMessageLabel = includeErrorMessageLabel;
    }

    /**
     * Creates both instruments and registers them, or registers neither.
     *
     * @param options naming, bucket and label configuration
     * @param registry the registry to register into
     * @return the registered instrument set
     * @throws dev.mars.querymetrics.api.error.DuplicateMetricException if either name is taken;
     *         the histogram is deregistered again when only the counter collides
     */
    public static QueryMetrics initialize(QueryExporterOptions options, MetricsRegistry registry) {
        HistogramInstrument histogram = registry.histogram(new HistogramSpec(
            options.getDurationHistogramName(),
            options.getDurationHistogramHelp(),
            options.getBucketBoundaries(),
            options.getExtraLabels()));

        CounterInstrument counter = registry.counter(new CounterSpec(
            options.getErrorCounterName(),
            options.getErrorCounterHelp(),
            options.isIncludeErrorMessageLabel() ? List.of(QueryExporterOptions.ERROR_LABEL) : List.of(),
            options.getExtraLabels()));

        registry.register(histogram);
        try {
            registry.register(counter);
        } catch (RuntimeException e) {
            registry.deregister(histogram.name());
            throw e;
        }

        logger.info("Query metrics registered: {} (buckets {}), {} (error label {})",
            histogram.name(), options.getBucketBoundaries(), counter.name(),
            options.isIncludeErrorMessageLabel() ? "enabled" : "disabled");
        return new QueryMetrics(histogram, counter, options.isIncludeErrorMessageLabel());
    }

    /**
     * Records the duration of one successful query.
     *
     * @param seconds elapsed time in seconds
     */
    public void observeDuration(double seconds) {
        durationHistogram.observe(seconds);
    }

    /**
     * Records the duration of one successful query measured on a monotonic clock.
     *
     * @param elapsedNanos elapsed time in nanoseconds
     */
    public void observeDurationNanos(long elapsedNanos) {
        durationHistogram.observe(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts one failed query.
     *
     * @param errorMessage the failure's message, used as the {@code error} label when enabled
     */
    public void countError(String errorMessage) {
        if (includeErrorMessageLabel) {
            errorCounter.increment(Map.of(QueryExporterOptions.ERROR_LABEL, errorMessage != null ? errorMessage : ""));
        } else {
            errorCounter.increment(Map.of());
        }
    }

    public HistogramInstrument getDurationHistogram() {
        return durationHistogram;
    }

    public CounterInstrument getErrorCounter() {
        return errorCounter;
    }
}
