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

import dev.mars.querymetrics.api.metrics.MetricsRegistry;
import dev.mars.querymetrics.core.bridge.QueryEventBridge;
import dev.mars.querymetrics.core.metrics.QueryMetrics;

import java.util.Optional;

/**
 * Handle returned by {@link QueryExporter#attach}.
 *
 * Detaching stops all further metric updates; the instruments stay registered with their
 * accumulated values so they can still be rendered.
 */
public final class QueryExporterHandle implements AutoCloseable {

    private final QueryEventBridge bridge;
    private final QueryMetrics metrics;
    private final MetricsRegistry implicitRegistry;

    QueryExporterHandle(QueryEventBridge bridge, QueryMetrics metrics, MetricsRegistry implicitRegistry) {
        this.bridge = bridge;
        this.metrics = metrics;
        this.implicitRegistry = implicitRegistry;
    }

    /**
     * Unsubscribes from the client. Idempotent.
     */
    public void detach() {
        bridge.detach();
    }

    /**
     * The registry the exporter created because none was supplied; empty when the caller
     * passed its own registry.
     */
    public Optional<MetricsRegistry> getRegistry() {
        return Optional.ofNullable(implicitRegistry);
    }

    public QueryMetrics getMetrics() {
        return metrics;
    }

    public boolean isDetached() {
        return bridge.isDetached();
    }

    /**
     * Number of queries that started and have not finished yet.
     */
    public int inFlightQueries() {
        return bridge.inFlightQueries();
    }

    @Override
    public void close() {
        detach();
    }
}
