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
package dev.mars.querymetrics.api.events;

/**
 * Immutable payload of a query lifecycle event.
 *
 * @param correlationId identifier assigned by the client, unique among in-flight queries
 * @param sql           the statement text, informational only (can be null)
 * @param error         the failure, only present on {@link QueryEventType#QUERY_FAILED}
 */
public record QueryEvent(
    String correlationId,
    String sql,
    Throwable error
) {

    public static QueryEvent started(String correlationId, String sql) {
        return new QueryEvent(correlationId, sql, null);
    }

    public static QueryEvent succeeded(String correlationId, String sql) {
        return new QueryEvent(correlationId, sql, null);
    }

    public static QueryEvent failed(String correlationId, String sql, Throwable error) {
        return new QueryEvent(correlationId, sql, error);
    }

    /**
     * Message of the failure, or null when the event carries no error.
     */
    public String errorMessage() {
        return error != null ? error.getMessage() : null;
    }
}
