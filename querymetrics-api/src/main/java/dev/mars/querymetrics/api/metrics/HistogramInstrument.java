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

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A histogram with fixed, ascending bucket boundaries.
 *
 * Every observation increments each bucket whose upper bound is greater than or equal to
 * the observed value, the implicit {@code +Inf} bucket, and the observation count, and adds
 * the value to the running sum.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public interface HistogramInstrument extends MetricInstrument {

    /**
     * Records one observation.
     *
     * @param value the observed value, in the histogram's unit (seconds for query durations)
     */
    void observe(double value);

    /**
     * Records one duration observation without going through a floating-point value.
     * The histogram's unit is seconds.
     *
     * @param amount the elapsed time
     * @param unit the unit of {@code amount}
     */
    default void observe(long amount, TimeUnit unit) {
        observe(unit.toNanos(amount) / (double) TimeUnit.SECONDS.toNanos(1));
    }

    /**
     * Upper bounds of the explicit buckets, ascending. {@code +Inf} is implicit.
     */
    List<Double> bucketBoundaries();

    /**
     * Number of observations recorded so far.
     */
    long count();

    /**
     * Sum of all observations recorded so far.
     */
    double sum();

    @Override
    default MetricType type() {
        return MetricType.HISTOGRAM;
    }
}
