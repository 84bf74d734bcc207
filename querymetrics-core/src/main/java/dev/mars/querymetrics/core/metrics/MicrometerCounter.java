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

import dev.mars.querymetrics.api.metrics.CounterInstrument;
import dev.mars.querymetrics.api.metrics.CounterSpec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counter backed by Micrometer {@link Counter}s, one per label set.
 *
 * <p>A counter without per-increment labels registers its single series eagerly, so it is
 * exposed as zero before the first increment. A counter with per-increment labels creates
 * each series on its first increment.</p>
 *
 * <p>Only the label names declared by the {@link CounterSpec} are taken from an increment; a declared
 * label missing from an increment is recorded as an empty value, so every series of the
 * counter has the same label names.</p>
 */
final class MicrometerCounter implements CounterInstrument, MicrometerInstrument {

    private final MicrometerMetricsRegistry owner;
    private final CounterSpec spec;
    private volatile MeterRegistry meterRegistry;
    private volatile Counter baseCounter;

    MicrometerCounter(MicrometerMetricsRegistry owner, CounterSpec spec) {
        this.owner = owner;
        this.spec = spec;
    }

    @Override
    public void bind(MeterRegistry meterRegistry) {
        if (!spec.hasDynamicLabels()) {
            baseCounter = Counter.builder(spec.name())
                .description(spec.help())
                .tags(MicrometerInstrument.toTags(spec.extraLabels()))
                .register(meterRegistry);
        }
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void unbind() {
        meterRegistry = null;
        baseCounter = null;
    }

    @Override
    public void increment(Map<String, String> labels) {
        MeterRegistry registry = meterRegistry;
        if (registry == null) {
            return;
        }
        if (!spec.hasDynamicLabels()) {
            Counter counter = baseCounter;
            if (counter != null) {
                counter.increment();
            }
            return;
        }

        Map<String, String> series = new LinkedHashMap<>(spec.extraLabels());
        for (String labelName : spec.labelNames()) {
            String value = labels.get(labelName);
            series.put(labelName, value != null ? value : "");
        }
        Counter.builder(spec.name())
            .description(spec.help())
            .tags(MicrometerInstrument.toTags(series))
            .register(registry)
            .increment();
    }

    @Override
    public double total() {
        MeterRegistry registry = meterRegistry;
        if (registry == null) {
            return 0.0;
        }
        return registry.find(spec.name()).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    @Override
    public String name() {
        return spec.name();
    }

    @Override
    public String help() {
        return spec.help();
    }

    @Override
    public MicrometerMetricsRegistry owner() {
        return owner;
    }

    @Override
    public String toString() {
        return "MicrometerCounter{name='" + spec.name() + "', labels=" + spec.labelNames() + '}';
    }
}
