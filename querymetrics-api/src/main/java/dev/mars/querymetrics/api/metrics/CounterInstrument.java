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

import java.util.Map;

/**
 * A monotonically increasing counter, partitioned into one series per distinct label set.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public interface CounterInstrument extends MetricInstrument {

    /**
     * Increments the series identified by the given labels by one.
     *
     * A label set not seen before starts a new series. The labels are merged with the
     * instrument's fixed extra labels; a per-increment label wins on a name clash.
     *
     * @param labels per-increment labels, may be empty
     */
    void increment(Map<String, String> labels);

    /**
     * Total across every series of this counter.
     */
    double total();

    @Override
    default MetricType type() {
        return MetricType.COUNTER;
    }
}
