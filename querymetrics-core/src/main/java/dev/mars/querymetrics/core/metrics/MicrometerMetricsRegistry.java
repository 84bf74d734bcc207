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

import dev.mars.querymetrics.api.error.DuplicateMetricException;
import dev.mars.querymetrics.api.error.QueryMetricsErrorCodes;
import dev.mars.querymetrics.api.metrics.CounterInstrument;
import dev.mars.querymetrics.api.metrics.CounterSpec;
import dev.mars.querymetrics.api.metrics.HistogramInstrument;
import dev.mars.querymetrics.api.metrics.HistogramSpec;
import dev.mars.querymetrics.api.metrics.MetricInstrument;
import dev.mars.querymetrics.api.metrics.MetricType;
import dev.mars.querymetrics.api.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.stream.Collectors;

/**
 * {@link MetricsRegistry} on top of a Micrometer {@link MeterRegistry}.
 *
 * <p>Micrometer silently hands back an existing meter when the same name is registered
 * twice; this registry instead rejects, with a {@link DuplicateMetricException}, any name
 * already reserved on the same underlying meter registry (by this or any other
 * {@code MicrometerMetricsRegistry} wrapping it) and any name the meter registry already
 * holds.</p>
 *
 * <p>Text exposition is available when the underlying registry is a
 * {@link PrometheusMeterRegistry}. Micrometer's {@code _max} gauge that accompanies each
 * histogram registered here is left out of the exposition.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {
    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsRegistry.class);

    private static final String MAX_SUFFIX = "_max";

    // Names reserved per underlying meter registry, shared by every wrapper of it
    private static final Map<MeterRegistry, Map<String, MetricType>> RESERVED_NAMES = new WeakHashMap<>();

    private final MeterRegistry meterRegistry;
    private final Map<String, MetricType> reservedNames;
    private final Map<String, MicrometerInstrument> instruments = new LinkedHashMap<>(); // Guarded by reservedNames

    public MicrometerMetricsRegistry(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry must not be null");
        }
        this.meterRegistry = meterRegistry;
        this.reservedNames = reservedNamesFor(meterRegistry);
    }

    private static Map<String, MetricType> reservedNamesFor(MeterRegistry meterRegistry) {
        synchronized (RESERVED_NAMES) {
            return RESERVED_NAMES.computeIfAbsent(meterRegistry, registry -> new HashMap<>());
        }
    }

    /**
     * Creates a registry backed by a new {@link PrometheusMeterRegistry}.
     */
    public static MicrometerMetricsRegistry prometheus() {
        return new MicrometerMetricsRegistry(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    @Override
    public HistogramInstrument histogram(HistogramSpec spec) {
        return new MicrometerHistogram(this, spec);
    }

    @Override
    public CounterInstrument counter(CounterSpec spec) {
        return new MicrometerCounter(this, spec);
    }

    @Override
    public void register(MetricInstrument instrument) {
        if (!(instrument instanceof MicrometerInstrument micrometerInstrument)
                || micrometerInstrument.owner() != this) {
            throw new IllegalArgumentException(
                "Instrument " + instrument + " was not created by this registry ("
                    + QueryMetricsErrorCodes.FOREIGN_INSTRUMENT + ")");
        }

        String name = instrument.name();
        synchronized (reservedNames) {
            if (reservedNames.containsKey(name) || !meterRegistry.find(name).meters().isEmpty()) {
                throw new DuplicateMetricException(name);
            }
            micrometerInstrument.bind(meterRegistry);
            reservedNames.put(name, instrument.type());
            instruments.put(name, micrometerInstrument);
        }
        logger.debug("Registered {} metric '{}'", instrument.type(), name);
    }

    /**
     * Removes a metric registered through this registry, or a meter of that name that no
     * registry reserved. A name reserved by another registry on the same meter registry is
     * left alone.
     */
    @Override
    public boolean deregister(String name) {
        List<Meter> meters;
        MicrometerInstrument instrument;
        synchronized (reservedNames) {
            instrument = instruments.remove(name);
            if (instrument == null && reservedNames.containsKey(name)) {
                return false;
            }
            if (instrument != null) {
                instrument.unbind();
                reservedNames.remove(name);
            }

            // SimpleMeterRegistry publishes histogram buckets as "<name>.histogram" gauges
            meters = meterRegistry.getMeters().stream()
                .filter(meter -> name.equals(meter.getId().getName())
                    || (name + ".histogram").equals(meter.getId().getName()))
                .collect(Collectors.toList());
            meters.forEach(meterRegistry::remove);
        }

        boolean removed = instrument != null || !meters.isEmpty();
        if (removed) {
            logger.debug("Deregistered metric '{}' ({} series)", name, meters.size());
        }
        return removed;
    }

    @Override
    public boolean isRegistered(String name) {
        synchronized (reservedNames) {
            return instruments.containsKey(name);
        }
    }

    @Override
    public String scrape() {
        if (!(meterRegistry instanceof PrometheusMeterRegistry prometheusRegistry)) {
            throw new UnsupportedOperationException(meterRegistry.getClass().getSimpleName()
                + " cannot render the text exposition format (" + QueryMetricsErrorCodes.SCRAPE_UNSUPPORTED + ")");
        }

        Set<String> maxFamilies = new HashSet<>();
        synchronized (reservedNames) {
            reservedNames.forEach((name, type) -> {
                if (type == MetricType.HISTOGRAM) {
                    maxFamilies.add(meterRegistry.config().namingConvention()
                        .name(name, Meter.Type.TIMER, "seconds") + MAX_SUFFIX);
                }
            });
        }

        String text = prometheusRegistry.scrape();
        if (maxFamilies.isEmpty()) {
            return text;
        }
        return text.lines()
            .filter(line -> !maxFamilies.contains(familyOf(line)))
            .collect(Collectors.joining("\n", "", "\n"));
    }

    /**
     * Metric family a line of the text format belongs to: the name after {@code # HELP} or
     * {@code # TYPE}, or the sample name up to its labels or value.
     */
    static String familyOf(String line) {
        String body = line.startsWith("# HELP ") || line.startsWith("# TYPE ") ? line.substring(7) : line;
        int end = 0;
        while (end < body.length() && body.charAt(end) != ' ' && body.charAt(end) != '{') {
            end++;
        }
        return body.substring(0, end);
    }

    @Override
    public String toString() {
        return "MicrometerMetricsRegistry{meterRegistry=" + meterRegistry.getClass().getSimpleName() + '}';
    }
}
