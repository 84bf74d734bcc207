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
package dev.mars.querymetrics.core;

import dev.mars.querymetrics.api.QueryExporterOptions;
import dev.mars.querymetrics.api.error.QueryMetricsConfigurationException;
import dev.mars.querymetrics.api.error.QueryMetricsErrorCodes;
import dev.mars.querymetrics.api.events.QueryEventSource;
import dev.mars.querymetrics.api.metrics.MetricsRegistry;
import dev.mars.querymetrics.core.bridge.QueryEventBridge;
import dev.mars.querymetrics.core.metrics.MicrometerMetricsRegistry;
import dev.mars.querymetrics.core.metrics.QueryMetrics;
import dev.mars.querymetrics.core.tracker.CorrelationTracker;
import io.micrometer.core.instrument.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: attaches query duration and error metrics to a database client.
 *
 * <pre>{@code
 * QueryExporterHandle exporter = QueryExporter.attach(client);
 * ...
 * String exposition = exporter.getRegistry().orElseThrow().scrape();
 * exporter.detach();
 * }</pre>
 *
 * <p>With default options the client's queries are exposed as
 * {@code knex_query_duration_seconds} (histogram) and {@code knex_query_errors_total}
 * (counter, labelled with the error message).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public final class QueryExporter {
    private static final Logger logger = LoggerFactory.getLogger(QueryExporter.class);

    private QueryExporter() {
        // Static entry point only
    }

    public static QueryExporterHandle attach(QueryEventSource source) {
        return attach(source, QueryExporterOptions.defaults());
    }

    public static QueryExporterHandle attach(QueryEventSource source, QueryExporterOptions options) {
        return attach(source, options, Clock.SYSTEM);
    }

    /**
     * Registers the query instruments and subscribes to the client's lifecycle events.
     *
     * @param source the instrumented client
     * @param options metric naming and registry options
     * @param clock monotonic time source used to measure query durations
     * @return a handle to detach the exporter and, when no registry was supplied, to reach
     *         the registry that was created
     * @throws QueryMetricsConfigurationException if the source is missing or a metric name is
     *         already taken; nothing stays registered in that case
     */
    public static QueryExporterHandle attach(QueryEventSource source, QueryExporterOptions options, Clock clock) {
        if (source == null) {
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.MISSING_EVENT_SOURCE,
                "A query event source is required");
        }
        if (options == null) {
            options = QueryExporterOptions.defaults();
        }

        boolean implicitRegistry = options.getRegistry().isEmpty();
        MetricsRegistry registry = options.getRegistry().orElseGet(MicrometerMetricsRegistry::prometheus);

        QueryMetrics metrics = QueryMetrics.initialize(options, registry);
        QueryEventBridge bridge = new QueryEventBridge(new CorrelationTracker(), metrics, clock,
            options.getStaleEntryTimeout().orElse(null));
        try {
            bridge.attach(source);
        } catch (RuntimeException e) {
            bridge.detach();
            registry.deregister(metrics.getDurationHistogram().name());
            registry.deregister(metrics.getErrorCounter().name());
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INTERNAL_ERROR,
                "Failed to subscribe to query events: " + e.getMessage(), e);
        }

        logger.info("Query exporter attached to {} with {}", source.getClass().getSimpleName(), options);
        return new QueryExporterHandle(bridge, metrics, implicitRegistry ? registry : null);
    }
}
