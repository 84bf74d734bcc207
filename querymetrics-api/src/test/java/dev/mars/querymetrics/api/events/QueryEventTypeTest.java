package dev.mars.querymetrics.api.events;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class QueryEventTypeTest {

    @Test
    void testChannelNames() {
        assertEquals("query", QueryEventType.QUERY_STARTED.channel());
        assertEquals("query-response", QueryEventType.QUERY_SUCCEEDED.channel());
        assertEquals("query-error", QueryEventType.QUERY_FAILED.channel());
    }

    @Test
    void testFromChannel() {
        for (QueryEventType type : QueryEventType.values()) {
            assertSame(type, QueryEventType.fromChannel(type.channel()));
        }
        assertThrows(IllegalArgumentException.class, () -> QueryEventType.fromChannel("query-timeout"));
    }

    @Test
    void testTerminalEvents() {
        assertFalse(QueryEventType.QUERY_STARTED.isTerminal());
        assertTrue(QueryEventType.QUERY_SUCCEEDED.isTerminal());
        assertTrue(QueryEventType.QUERY_FAILED.isTerminal());
    }

    @Test
    void testEventErrorMessage() {
        QueryEvent failed = QueryEvent.failed("q-1", "select 1", new IllegalStateException("connection reset"));
        assertEquals("connection reset", failed.errorMessage());
        assertNull(QueryEvent.succeeded("q-1", "select 1").errorMessage());
        assertNull(QueryEvent.failed("q-2", null, null).errorMessage());
    }
}
