package dev.mars.querymetrics.core.metrics;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 */

import dev.mars.querymetrics.api.QueryExporterOptions;
import dev.mars.querymetrics.api.error.DuplicateMetricException;
import dev.mars.querymetrics.test.categories.TestCategories;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
public class QueryMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private MicrometerMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new MicrometerMetricsRegistry(meterRegistry);
    }

    private Set<String> meterNames() {
        return meterRegistry.getMeters().stream()
            .map(meter -> meter.getId().getName())
            .collect(Collectors.toSet());
    }

    @Test
    void testInitializeRegistersBothInstruments() {
        QueryMetrics metrics = QueryMetrics.initialize(QueryExporterOptions.defaults(), registry);

        assertTrue(registry.isRegistered("knex_query_duration_seconds"));
        assertTrue(registry.isRegistered("knex_query_errors_total"));
        assertEquals("knex_query_duration_seconds", metrics.getDurationHistogram().name());
        assertEquals("histogram of query responses", metrics.getDurationHistogram().help());
        assertEquals("counter of query errors with labels: error", metrics.getErrorCounter().help());
        assertEquals(QueryExporterOptions.DEFAULT_BUCKET_BOUNDARIES, metrics.getDurationHistogram().bucketBoundaries());
    }

    @Test
    void testPrefixGivesExactlyTwoNames() {
        MicrometerMetricsRegistry prometheus = MicrometerMetricsRegistry.prometheus();
        QueryExporterOptions options = new QueryExporterOptions.Builder()
            .namePrefix("foo_")
            .build();

        QueryMetrics metrics = QueryMetrics.initialize(options, prometheus);
        metrics.observeDurationNanos(TimeUnit.MILLISECONDS.toNanos(40));
        metrics.countError("boom");

        Set<String> families = prometheus.scrape().lines()
            .filter(line -> line.startsWith("# TYPE "))
            .map(line -> line.substring("# TYPE ".length()))
            .collect(Collectors.toSet());
        assertEquals(Set.of("foo_query_duration_seconds histogram", "foo_query_errors_total counter"), families);
    }

    @Test
    void testCounterCollisionRollsBackHistogram() {
        Counter.builder("knex_query_errors_total").register(meterRegistry);

        assertThrows(DuplicateMetricException.class,
            () -> QueryMetrics.initialize(QueryExporterOptions.defaults(), registry));

        assertFalse(registry.isRegistered("knex_query_duration_seconds"));
        assertTrue(meterRegistry.find("knex_query_duration_seconds").meters().isEmpty());
        assertEquals(Set.of("knex_query_errors_total"), meterNames());
    }

    @Test
    void testHistogramCollisionRegistersNothing() {
        QueryMetrics.initialize(QueryExporterOptions.defaults(), registry);
        List<Meter> before = meterRegistry.getMeters();

        assertThrows(DuplicateMetricException.class,
            () -> QueryMetrics.initialize(QueryExporterOptions.defaults(), registry));

        assertEquals(before.size(), meterRegistry.getMeters().size());
        assertTrue(registry.isRegistered("knex_query_errors_total"));
    }

    @Test
    void testSecondInstanceWithDifferentPrefixCoexists() {
        QueryMetrics.initialize(QueryExporterOptions.defaults(), registry);
        QueryMetrics.initialize(new QueryExporterOptions.Builder().namePrefix("replica_").build(), registry);

        assertTrue(registry.isRegistered("replica_query_duration_seconds"));
        assertTrue(registry.isRegistered("knex_query_duration_seconds"));
    }

    @Test
    void testCountErrorWithMessageLabel() {
        QueryMetrics metrics = QueryMetrics.initialize(QueryExporterOptions.defaults(), registry);

        metrics.countError("relation \"users\" does not exist");
        metrics.countError("relation \"users\" does not exist");
        metrics.countError(null);

        assertEquals(2.0, meterRegistry.get("knex_query_errors_total")
            .tag("error", "relation \"users\" does not exist").counter().count());
        assertEquals(1.0, meterRegistry.get("knex_query_errors_total").tag("error", "").counter().count());
        assertEquals(3.0, metrics.getErrorCounter().total());
    }

    @Test
    void testCountErrorWithoutMessageLabel() {
        QueryExporterOptions options = new QueryExporterOptions.Builder()
            .includeErrorMessageLabel(false)
            .build();
        QueryMetrics metrics = QueryMetrics.initialize(options, registry);

        metrics.countError("timeout");
        metrics.countError("syntax error");

        List<Counter> counters = List.copyOf(meterRegistry.find("knex_query_errors_total").counters());
        assertEquals(1, counters.size());
        assertEquals(2.0, counters.get(0).count());
        assertNull(counters.get(0).getId().getTag("error"));
        assertEquals("counter of query errors", metrics.getErrorCounter().help());
    }

    @Test
    void testObserveDuration() {
        QueryMetrics metrics = QueryMetrics.initialize(QueryExporterOptions.defaults(), registry);

        metrics.observeDuration(0.02);
        metrics.observeDuration(0.2);

        assertEquals(2, metrics.getDurationHistogram().count());
        assertEquals(0.22, metrics.getDurationHistogram().sum(), 1e-9);
    }

    @Test
    void testExtraLabelsOnEverySeries() {
        QueryExporterOptions options = new QueryExporterOptions.Builder()
            .extraLabel("foo", "bar")
            .build();
        QueryMetrics metrics = QueryMetrics.initialize(options, registry);

        metrics.observeDuration(0.01);
        metrics.countError("boom");

        assertFalse(meterRegistry.getMeters().isEmpty());
        for (Meter meter : meterRegistry.getMeters()) {
            assertEquals("bar", meter.getId().getTag("foo"), "Missing extra label on " + meter.getId());
        }
    }
}
