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
 * Description of a counter instrument.
 *
 * @param name        final metric name
 * @param help        help text rendered in the exposition
 * @param labelNames  names of the labels supplied per increment (e.g. {@code error})
 * @param extraLabels fixed labels attached to every increment
 */
public record CounterSpec(
    String name,
    String help,
    List<String> labelNames,
    Map<String, String> extraLabels
) {
    public CounterSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(help, "help");
        labelNames = List.copyOf(labelNames);
        extraLabels = Map.copyOf(extraLabels);
    }

    /**
     * True when increments carry labels of their own, in which case series only appear once
     * they have been incremented.
     */
    public boolean hasDynamicLabels() {
        return !labelNames.isEmpty();
    }
}
