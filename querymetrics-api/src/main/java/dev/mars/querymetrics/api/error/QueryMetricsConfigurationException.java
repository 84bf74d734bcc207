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
 * Raised when an exporter cannot be built from the supplied configuration.
 * Nothing is left registered when this is thrown.
 */
public class QueryMetricsConfigurationException extends QueryMetricsException {

    public QueryMetricsConfigurationException(String code, String message) {
        super(code, message);
    }

    public QueryMetricsConfigurationException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
