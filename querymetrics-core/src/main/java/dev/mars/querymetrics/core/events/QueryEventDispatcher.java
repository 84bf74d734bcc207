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
package dev.mars.querymetrics.core.events;

import dev.mars.querymetrics.api.events.QueryEvent;
import dev.mars.querymetrics.api.events.QueryEventListener;
import dev.mars.querymetrics.api.events.QueryEventSource;
import dev.mars.querymetrics.api.events.QueryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link QueryEventSource} that delivers events synchronously to its listeners.
 *
 * <p>Database clients embed a dispatcher and call {@link #emit} around each query.
 * Listeners run on the emitting thread, in subscription order. A listener that throws is
 * logged and does not stop delivery to the remaining listeners, nor does the exception
 * reach the emitting client.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class QueryEventDispatcher implements QueryEventSource {
    private static final Logger logger = LoggerFactory.getLogger(QueryEventDispatcher.class);

    private final Map<QueryEventType, CopyOnWriteArrayList<QueryEventListener>> listeners = new EnumMap<>(QueryEventType.class);

    public QueryEventDispatcher() {
        for (QueryEventType type : QueryEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public void subscribe(QueryEventType type, QueryEventListener listener) {
        if (type == null || listener == null) {
            throw new IllegalArgumentException("Event type and listener are required");
        }
        listeners.get(type).addIfAbsent(listener);
    }

    @Override
    public void unsubscribe(QueryEventType type, QueryEventListener listener) {
        if (type == null || listener == null) {
            return;
        }
        listeners.get(type).remove(listener);
    }

    /**
     * Delivers an event to every listener of its channel.
     *
     * @param type the channel
     * @param event the payload
     */
    public void emit(QueryEventType type, QueryEvent event) {
        for (QueryEventListener listener : listeners.get(type)) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed on '{}' event for query {}",
                    listener, type.channel(), event != null ? event.correlationId() : null, e);
            }
        }
    }

    public int listenerCount(QueryEventType type) {
        return listeners.get(type).size();
    }
}
