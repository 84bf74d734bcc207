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
 * Standard error codes for QueryMetrics.
 *
 * Error code ranges:
 * - QMERR0001-0049: General errors
 * - QMERR0100-0149: Configuration errors
 * - QMERR0150-0199: Registry errors
 */
public final class QueryMetricsErrorCodes {

    private QueryMetricsErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "QMERR0001";

    // ========================================================================
    // Configuration Errors (0100-0149)
    // ========================================================================
    public static final String MISSING_EVENT_SOURCE = "QMERR0100";
    public static final String INVALID_METRIC_NAME = "QMERR0101";
    public static final String INVALID_BUCKETS = "QMERR0102";
    public static final String INVALID_LABEL = "QMERR0103";
    public static final String INVALID_CONFIGURATION = "QMERR0104";

    // ========================================================================
    // Registry Errors (0150-0199)
    // ========================================================================
    public static final String DUPLICATE_METRIC = "QMERR0150";
    public static final String FOREIGN_INSTRUMENT = "QMERR0151";
    public static final String SCRAPE_UNSUPPORTED = "QMERR0152";
}
