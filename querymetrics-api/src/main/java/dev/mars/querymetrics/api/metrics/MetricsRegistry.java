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
package dev.mars.querymetrics.api.metrics;

import dev.mars.querymetrics.api.error.DuplicateMetricException;

/**
 * Registry abstraction that owns metric instruments and renders them.
 *
 * A registry may be shared by several exporters (one per instrumented client). It
 * serializes concurrent registration; instrument updates may happen from any thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public interface MetricsRegistry {

    /**
     * Creates an unregistered histogram bound to this registry.
     */
    HistogramInstrument histogram(HistogramSpec spec);

    /**
     * Creates an unregistered counter bound to this registry.
     */
    CounterInstrument counter(CounterSpec spec);

    /**
     * Registers an instrument under its final name.
     *
     * @param instrument an instrument created by this registry
     * @throws DuplicateMetricException if a metric with the same name is already registered
     * @throws IllegalArgumentException if the instrument was not created by this registry
     */
    void register(MetricInstrument instrument);

    /**
     * Removes a metric and all of its series. Unknown names are ignored.
     *
     * @param name final metric name
     * @return true if something was removed
     */
    boolean deregister(String name);

    boolean isRegistered(String name);

    /**
     * Renders every registered metric in the Prometheus text exposition format.
     *
     * @throws UnsupportedOperationException if the backing registry cannot render text
     */
    String scrape();
}
