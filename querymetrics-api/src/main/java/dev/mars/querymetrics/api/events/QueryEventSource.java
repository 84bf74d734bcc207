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
 * A database client that publishes query lifecycle events.
 *
 * The client owns correlation identifiers: every event of one query carries the same
 * identifier, and an identifier is not reused before the query's terminal event
 * ({@link QueryEventType#QUERY_SUCCEEDED} or {@link QueryEventType#QUERY_FAILED}) fired.
 *
 * Subscribing and unsubscribing are idempotent and may happen in any order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public interface QueryEventSource {

    /**
     * Registers a listener on one channel. Registering the same listener twice has no effect.
     *
     * @param type the channel
     * @param listener the listener
     */
    void subscribe(QueryEventType type, QueryEventListener listener);

    /**
     * Removes a listener from one channel. Removing an unknown listener has no effect.
     *
     * @param type the channel
     * @param listener the listener
     */
    void unsubscribe(QueryEventType type, QueryEventListener listener);
}
