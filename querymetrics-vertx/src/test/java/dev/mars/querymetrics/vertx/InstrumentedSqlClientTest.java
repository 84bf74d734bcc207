package dev.mars.querymetrics.vertx;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 */

import dev.mars.querymetrics.api.events.QueryEvent;
import dev.mars.querymetrics.api.events.QueryEventType;
import dev.mars.querymetrics.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.sqlclient.PreparedQuery;
import io.vertx.sqlclient.Query;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * CORE tests for InstrumentedSqlClient against a mocked Vert.x SqlClient.
 */
@Tag(TestCategories.CORE)
@ExtendWith(MockitoExtension.class)
public class InstrumentedSqlClientTest {

    @Mock
    private SqlClient sqlClient;

    @Mock
    private Query<RowSet<Row>> query;

    @Mock
    private PreparedQuery<RowSet<Row>> preparedQuery;

    @Mock
    private RowSet<Row> rowSet;

    private InstrumentedSqlClient client;
    private final List<String> events = new ArrayList<>();
    private final List<QueryEvent> failures = new ArrayList<>();

    @BeforeEach
    void setUp() {
        client = new InstrumentedSqlClient("orders", sqlClient);
        client.subscribe(QueryEventType.QUERY_STARTED, event -> events.add("query:" + event.correlationId()));
        client.subscribe(QueryEventType.QUERY_SUCCEEDED, event -> events.add("query-response:" + event.correlationId()));
        client.subscribe(QueryEventType.QUERY_FAILED, event -> {
            events.add("query-error:" + event.correlationId());
            failures.add(event);
        });
    }

    @Test
    void testSuccessfulQueryEmitsStartedThenSucceeded() {
        when(sqlClient.query("SELECT 1")).thenReturn(query);
        when(query.execute()).thenReturn(Future.succeededFuture(rowSet));

        Future<RowSet<Row>> result = client.query("SELECT 1");

        assertTrue(result.succeeded());
        assertSame(rowSet, result.result());
        assertEquals(List.of("query:orders-1", "query-response:orders-1"), events);
    }

    @Test
    void testFailedQueryEmitsStartedThenFailed() {
        IllegalStateException error = new IllegalStateException("relation \"users\" does not exist");
        when(sqlClient.preparedQuery("SELECT * FROM users WHERE id = $1")).thenReturn(preparedQuery);
        when(preparedQuery.execute(any(Tuple.class))).thenReturn(Future.failedFuture(error));

        Future<RowSet<Row>> result = client.preparedQuery("SELECT * FROM users WHERE id = $1", Tuple.of(7));

        assertTrue(result.failed());
        assertSame(error, result.cause());
        assertEquals(List.of("query:orders-1", "query-error:orders-1"), events);
        assertEquals("relation \"users\" does not exist", failures.get(0).errorMessage());
        assertEquals("SELECT * FROM users WHERE id = $1", failures.get(0).sql());
    }

    @Test
    void testPreparedQueryWithoutParameters() {
        when(sqlClient.preparedQuery("SELECT now()")).thenReturn(preparedQuery);
        when(preparedQuery.execute()).thenReturn(Future.succeededFuture(rowSet));

        client.preparedQuery("SELECT now()");

        assertEquals(List.of("query:orders-1", "query-response:orders-1"), events);
    }

    @Test
    void testSynchronousDriverFailureIsReportedAsFailedEvent() {
        when(sqlClient.query("SELECT 1")).thenThrow(new IllegalStateException("Pool closed"));

        Future<RowSet<Row>> result = client.query("SELECT 1");

        assertTrue(result.failed());
        assertEquals("Pool closed", result.cause().getMessage());
        assertEquals(List.of("query:orders-1", "query-error:orders-1"), events);
    }

    @Test
    void testTerminalEventWaitsForCompletion() {
        Promise<RowSet<Row>> promise = Promise.promise();
        when(sqlClient.query("SELECT pg_sleep(1)")).thenReturn(query);
        when(query.execute()).thenReturn(promise.future());

        client.query("SELECT pg_sleep(1)");
        assertEquals(List.of("query:orders-1"), events);

        promise.complete(rowSet);
        assertEquals(List.of("query:orders-1", "query-response:orders-1"), events);
    }

    @Test
    void testCorrelationIdsAreUniquePerQuery() {
        when(sqlClient.query(anyString())).thenReturn(query);
        when(query.execute()).thenReturn(Future.succeededFuture(rowSet));

        client.query("SELECT 1");
        client.query("SELECT 2");
        client.query("SELECT 3");

        assertEquals(List.of(
            "query:orders-1", "query-response:orders-1",
            "query:orders-2", "query-response:orders-2",
            "query:orders-3", "query-response:orders-3"), events);
    }

    @Test
    void testListenerFailureDoesNotAffectCaller() {
        when(sqlClient.query("SELECT 1")).thenReturn(query);
        when(query.execute()).thenReturn(Future.succeededFuture(rowSet));
        client.subscribe(QueryEventType.QUERY_SUCCEEDED, event -> {
            throw new IllegalStateException("listener bug");
        });

        Future<RowSet<Row>> result = client.query("SELECT 1");

        assertTrue(result.succeeded());
    }

    @Test
    void testCloseClosesDelegate() {
        when(sqlClient.close()).thenReturn(Future.failedFuture("already closed"));

        assertDoesNotThrow(client::close);

        verify(sqlClient).close();
    }

    @Test
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new InstrumentedSqlClient("", sqlClient));
        assertThrows(IllegalArgumentException.class, () -> new InstrumentedSqlClient("orders", null));
    }
}
