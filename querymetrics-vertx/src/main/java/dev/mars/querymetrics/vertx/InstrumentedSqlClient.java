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
package dev.mars.querymetrics.vertx;

import dev.mars.querymetrics.api.events.QueryEvent;
import dev.mars.querymetrics.api.events.QueryEventListener;
import dev.mars.querymetrics.api.events.QueryEventSource;
import dev.mars.querymetrics.api.events.QueryEventType;
import dev.mars.querymetrics.core.events.QueryEventDispatcher;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Vert.x SQL client that publishes a lifecycle event for every query it runs.
 *
 * <p>Each query gets a correlation id of the form {@code <clientId>-<sequence>}. The
 * started event fires before the query is handed to the driver; the succeeded or failed
 * event fires when the driver's future completes. The returned future is the driver's
 * own, so callers see exactly the same result and failure as without instrumentation.</p>
 *
 * <pre>{@code
 * InstrumentedSqlClient client = new InstrumentedSqlClient("orders", pool);
 * QueryExporterHandle exporter = QueryExporter.attach(client);
 * client.query("SELECT 1");
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class InstrumentedSqlClient implements QueryEventSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InstrumentedSqlClient.class);

    private final String clientId;
    private final SqlClient delegate;
    private final QueryEventDispatcher dispatcher = new QueryEventDispatcher();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param clientId prefix of the correlation ids, typically the pool or service name
     * @param delegate the client or pool that runs the queries
     */
    public InstrumentedSqlClient(String clientId, SqlClient delegate) {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("delegate SqlClient is required");
        }
        this.clientId = clientId;
        this.delegate = delegate;
    }

    /**
     * Runs a simple query.
     */
    public Future<RowSet<Row>> query(String sql) {
        String correlationId = start(sql);
        Future<RowSet<Row>> result;
        try {
            result = delegate.query(sql).execute();
        } catch (RuntimeException e) {
            return fail(correlationId, sql, e);
        }
        return observe(correlationId, sql, result);
    }

    /**
     * Runs a prepared query without parameters.
     */
    public Future<RowSet<Row>> preparedQuery(String sql) {
        String correlationId = start(sql);
        Future<RowSet<Row>> result;
        try {
            result = delegate.preparedQuery(sql).execute();
        } catch (RuntimeException e) {
            return fail(correlationId, sql, e);
        }
        return observe(correlationId, sql, result);
    }

    /**
     * Runs a prepared query with parameters.
     */
    public Future<RowSet<Row>> preparedQuery(String sql, Tuple params) {
        String correlationId = start(sql);
        Future<RowSet<Row>> result;
        try {
            result = delegate.preparedQuery(sql).execute(params);
        } catch (RuntimeException e) {
            return fail(correlationId, sql, e);
        }
        return observe(correlationId, sql, result);
    }

    @Override
    public void subscribe(QueryEventType type, QueryEventListener listener) {
        dispatcher.subscribe(type, listener);
    }

    @Override
    public void unsubscribe(QueryEventType type, QueryEventListener listener) {
        dispatcher.unsubscribe(type, listener);
    }

    public String getClientId() {
        return clientId;
    }

    public SqlClient getDelegate() {
        return delegate;
    }

    /**
     * Closes the underlying client.
     */
    @Override
    public void close() {
        delegate.close()
            .onFailure(e -> logger.warn("Failed to close SQL client {}", clientId, e));
    }

    private String start(String sql) {
        String correlationId = clientId + "-" + sequence.incrementAndGet();
        dispatcher.emit(QueryEventType.QUERY_STARTED, QueryEvent.started(correlationId, sql));
        return correlationId;
    }

    private <T> Future<T> observe(String correlationId, String sql, Future<T> result) {
        result.onSuccess(rows ->
            dispatcher.emit(QueryEventType.QUERY_SUCCEEDED, QueryEvent.succeeded(correlationId, sql)));
        result.onFailure(error ->
            dispatcher.emit(QueryEventType.QUERY_FAILED, QueryEvent.failed(correlationId, sql, error)));
        return result;
    }

    private <T> Future<T> fail(String correlationId, String sql, RuntimeException error) {
        logger.debug("Query {} was rejected by the driver: {}", correlationId, error.getMessage());
        dispatcher.emit(QueryEventType.QUERY_FAILED, QueryEvent.failed(correlationId, sql, error));
        return Future.failedFuture(error);
    }
}
