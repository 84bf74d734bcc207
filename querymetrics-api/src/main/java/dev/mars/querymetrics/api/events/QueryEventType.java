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
 * The three lifecycle channels a database client publishes for every query.
 *
 * <p>Each constant carries the channel name used by the client on the wire
 * ({@code query}, {@code query-response}, {@code query-error}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public enum QueryEventType {

    /** The query was handed to the driver. */
    QUERY_STARTED("query"),

    /** The query completed and a response was received. */
    QUERY_SUCCEEDED("query-response"),

    /** The query failed. The event carries the error. */
    QUERY_FAILED("query-error");

    private final String channel;

    QueryEventType(String channel) {
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }

    /**
     * Resolves a channel name back to its event type.
     *
     * @param channel the channel name, e.g. {@code "query-response"}
     * @return the matching event type
     * @throws IllegalArgumentException if the channel is unknown
     */
    public static QueryEventType fromChannel(String channel) {
        for (QueryEventType type : values()) {
            if (type.channel.equals(channel)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown query event channel: " + channel);
    }

    public boolean isTerminal() {
        return this != QUERY_STARTED;
    }
}
