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
package dev.mars.querymetrics.api.error;

/**
 * Raised when a metric name is already taken in the target registry.
 *
 * Two instrumented clients sharing one registry need distinct prefixes or metric names.
 */
public class DuplicateMetricException extends QueryMetricsConfigurationException {

    private final String metricName;

    public DuplicateMetricException(String metricName) {
        super(QueryMetricsErrorCodes.DUPLICATE_METRIC,
              "A metric named '" + metricName + "' is already registered");
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
