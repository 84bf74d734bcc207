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

import dev.mars.querymetrics.api.metrics.HistogramInstrument;
import dev.mars.querymetrics.api.metrics.HistogramSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Duration histogram backed by a Micrometer {@link Timer} whose service level objectives
 * are the bucket boundaries. The Prometheus registry renders it as a cumulative histogram
 * in seconds.
 *
 * <p>Observations are kept in nanoseconds, so sub-second boundaries such as 3 ms bucket
 * exactly. The Prometheus naming convention appends {@code _seconds} to a name that does
 * not already end with it.</p>
 */
final class MicrometerHistogram implements HistogramInstrument, MicrometerInstrument {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final MicrometerMetricsRegistry owner;
    private final HistogramSpec spec;
    private volatile Timer timer;

    MicrometerHistogram(MicrometerMetricsRegistry owner, HistogramSpec spec) {
        this.owner = owner;
        this.spec = spec;
    }

    @Override
    public void bind(MeterRegistry meterRegistry) {
        Duration[] slos = spec.bucketBoundaries().stream()
            .map(seconds -> Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND)))
            .toArray(Duration[]::new);
        timer = Timer.builder(spec.name())
            .description(spec.help())
            .tags(MicrometerInstrument.toTags(spec.extraLabels()))
            .serviceLevelObjectives(slos)
            .register(meterRegistry);
    }

    @Override
    public void unbind() {
        timer = null;
    }

    @Override
    public void observe(double seconds) {
        observe(Math.round(seconds * NANOS_PER_SECOND), TimeUnit.NANOSECONDS);
    }

    @Override
    public void observe(long amount, TimeUnit unit) {
        Timer current = timer;
        if (current != null) {
            current.record(amount, unit);
        }
    }

    @Override
    public List<Double> bucketBoundaries() {
        return spec.bucketBoundaries();
    }

    @Override
    public long count() {
        Timer current = timer;
        return current != null ? current.count() : 0L;
    }

    @Override
    public double sum() {
        Timer current = timer;
        return current != null ? current.totalTime(TimeUnit.SECONDS) : 0.0;
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
        return "MicrometerHistogram{name='" + spec.name() + "', buckets=" + spec.bucketBoundaries() + '}';
    }
}
