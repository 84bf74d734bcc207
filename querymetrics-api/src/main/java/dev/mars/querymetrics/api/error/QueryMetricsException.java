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
 * Base type of every error raised by QueryMetrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class QueryMetricsException extends RuntimeException {

    private final String code;

    public QueryMetricsException(String code, String message) {
        super(message);
        this.code = code;
    }

    public QueryMetricsException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * The {@link QueryMetricsErrorCodes} constant describing this error.
     */
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
