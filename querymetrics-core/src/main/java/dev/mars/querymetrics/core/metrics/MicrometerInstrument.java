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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Map;

/**
 * An instrument whose Micrometer meters only exist while it is registered.
 */
interface MicrometerInstrument {

    MicrometerMetricsRegistry owner();

    /**
     * Creates the backing meters in the given registry.
     */
    void bind(MeterRegistry meterRegistry);

    /**
     * Drops the backing meters; later updates become no-ops.
     */
    void unbind();

    static Tags toTags(Map<String, String> labels) {
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> label : labels.entrySet()) {
            tags = tags.and(label.getKey(), label.getValue() != null ? label.getValue() : "");
        }
        return tags;
    }
}
