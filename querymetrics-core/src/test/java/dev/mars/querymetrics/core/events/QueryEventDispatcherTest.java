package dev.mars.querymetrics.core.events;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 */

import dev.mars.querymetrics.api.events.QueryEvent;
import dev.mars.querymetrics.api.events.QueryEventListener;
import dev.mars.querymetrics.api.events.QueryEventType;
import dev.mars.querymetrics.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
public class QueryEventDispatcherTest {

    private QueryEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new QueryEventDispatcher();
    }

    @Test
    void testEmitReachesOnlyItsChannel() {
        List<QueryEvent> started = new ArrayList<>();
        List<QueryEvent> failed = new ArrayList<>();
        dispatcher.subscribe(QueryEventType.QUERY_STARTED, started::add);
        dispatcher.subscribe(QueryEventType.QUERY_FAILED, failed::add);

        QueryEvent event = QueryEvent.started("q-1", "select 1");
        dispatcher.emit(QueryEventType.QUERY_STARTED, event);

        assertEquals(List.of(event), started);
        assertTrue(failed.isEmpty());
    }

    @Test
    void testSubscribeTwiceDeliversOnce() {
        List<QueryEvent> received = new ArrayList<>();
        QueryEventListener listener = received::add;

        dispatcher.subscribe(QueryEventType.QUERY_SUCCEEDED, listener);
        dispatcher.subscribe(QueryEventType.QUERY_SUCCEEDED, listener);
        dispatcher.emit(QueryEventType.QUERY_SUCCEEDED, QueryEvent.succeeded("q-1", null));

        assertEquals(1, dispatcher.listenerCount(QueryEventType.QUERY_SUCCEEDED));
        assertEquals(1, received.size());
    }

    @Test
    void testUnsubscribe() {
        List<QueryEvent> received = new ArrayList<>();
        QueryEventListener listener = received::add;
        dispatcher.subscribe(QueryEventType.QUERY_STARTED, listener);

        dispatcher.unsubscribe(QueryEventType.QUERY_STARTED, listener);
        dispatcher.unsubscribe(QueryEventType.QUERY_STARTED, listener);
        dispatcher.unsubscribe(QueryEventType.QUERY_STARTED, null);
        dispatcher.emit(QueryEventType.QUERY_STARTED, QueryEvent.started("q-1", null));

        assertEquals(0, dispatcher.listenerCount(QueryEventType.QUERY_STARTED));
        assertTrue(received.isEmpty());
    }

    @Test
    void testFailingListenerDoesNotStopDelivery() {
        List<QueryEvent> received = new ArrayList<>();
        dispatcher.subscribe(QueryEventType.QUERY_FAILED, event -> {
            throw new IllegalStateException("listener bug");
        });
        dispatcher.subscribe(QueryEventType.QUERY_FAILED, received::add);

        assertDoesNotThrow(() -> dispatcher.emit(QueryEventType.QUERY_FAILED,
            QueryEvent.failed("q-1", null, new RuntimeException("boom"))));
        assertEquals(1, received.size());
    }

    @Test
    void testSubscribeRejectsNulls() {
        assertThrows(IllegalArgumentException.class,
            () -> dispatcher.subscribe(null, event -> { }));
        assertThrows(IllegalArgumentException.class,
            () -> dispatcher.subscribe(QueryEventType.QUERY_STARTED, null));
    }
}
