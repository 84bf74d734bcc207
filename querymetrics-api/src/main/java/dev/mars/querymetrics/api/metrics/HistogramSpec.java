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
import java.util.Map;
import java.util.Objects;

/**
 * Description of a histogram instrument.
 *
 * @param name             final metric name
 * @param help             help text rendered in the exposition
 * @param bucketBoundaries ascending upper bounds, {@code +Inf} excluded
 * @param extraLabels      fixed labels attached to every observation
 */
public record HistogramSpec(
    String name,
    String help,
    List<Double> bucketBoundaries,
    Map<String, String> extraLabels
) {
    public HistogramSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(help, "help");
        bucketBoundaries = List.copyOf(bucketBoundaries);
        extraLabels = Map.copyOf(extraLabels);
    }
}
