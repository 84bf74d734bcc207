package dev.mars.querymetrics.core.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 */

import dev.mars.querymetrics.api.QueryExporterOptions;
import dev.mars.querymetrics.api.error.QueryMetricsConfigurationException;
import dev.mars.querymetrics.api.error.QueryMetricsErrorCodes;
import dev.mars.querymetrics.core.metrics.MicrometerMetricsRegistry;
import dev.mars.querymetrics.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
public class QueryMetricsConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(QueryMetricsConfiguration.PREFIX);
        System.clearProperty("querymetrics.labels.zone");
    }

    @Test
    void testDefaultProfile() {
        QueryMetricsConfiguration config = new QueryMetricsConfiguration("default");
        QueryExporterOptions options = config.getExporterOptions();

        assertEquals("default", config.getProfile());
        assertEquals("knex_query_duration_seconds", options.getDurationHistogramName());
        assertEquals("knex_query_errors_total", options.getErrorCounterName());
        assertEquals(QueryExporterOptions.DEFAULT_BUCKET_BOUNDARIES, options.getBucketBoundaries());
        assertTrue(options.isIncludeErrorMessageLabel());
        assertTrue(options.getExtraLabels().isEmpty());
        assertTrue(options.getStaleEntryTimeout().isEmpty());
        assertTrue(options.getRegistry().isEmpty());
    }

    @Test
    void testProfileOverridesDefaults() {
        QueryExporterOptions options = new QueryMetricsConfiguration("test").getExporterOptions();

        assertEquals("test_query_duration_seconds", options.getDurationHistogramName());
        assertEquals(List.of(0.1, 0.3, 1.5, 10.0), options.getBucketBoundaries());
        assertFalse(options.isIncludeErrorMessageLabel());
        assertEquals(Map.of("service", "orders", "database", "primary"), options.getExtraLabels());
        assertEquals(Duration.ofMinutes(5), options.getStaleEntryTimeout().orElseThrow());
    }

    @Test
    void testUnknownProfileFallsBackToDefaults() {
        QueryExporterOptions options = new QueryMetricsConfiguration("staging").getExporterOptions();

        assertEquals("knex_query_errors_total", options.getErrorCounterName());
    }

    @Test
    void testExplicitOverridesWin() {
        Properties overrides = new Properties();
        overrides.setProperty(QueryMetricsConfiguration.PREFIX, "override_");
        overrides.setProperty(QueryMetricsConfiguration.ERRORS_NAME, "failures_total");
        overrides.setProperty(QueryMetricsConfiguration.LABELS_PREFIX + "service", "billing");

        QueryExporterOptions options = new QueryMetricsConfiguration("test", overrides).getExporterOptions();

        assertEquals("override_failures_total", options.getErrorCounterName());
        assertEquals("billing", options.getExtraLabels().get("service"));
        assertEquals("primary", options.getExtraLabels().get("database"));
    }

    @Test
    void testSystemPropertiesOverrideProfile() {
        System.setProperty(QueryMetricsConfiguration.PREFIX, "sys_");
        System.setProperty("querymetrics.labels.zone", "a");

        QueryMetricsConfiguration config = new QueryMetricsConfiguration("test");

        assertEquals("sys_query_duration_seconds", config.getExporterOptions().getDurationHistogramName());
        assertEquals("a", config.getExtraLabels().get("zone"));
    }

    @Test
    void testInvalidProfileCollectsEveryError() {
        QueryMetricsConfigurationException e = assertThrows(QueryMetricsConfigurationException.class,
            () -> new QueryMetricsConfiguration("broken"));

        assertEquals(QueryMetricsErrorCodes.INVALID_CONFIGURATION, e.getCode());
        assertTrue(e.getMessage().contains("'abc'"), e.getMessage());
        assertTrue(e.getMessage().contains("five minutes"), e.getMessage());
    }

    @Test
    void testInvalidOptionReported() {
        Properties overrides = new Properties();
        overrides.setProperty(QueryMetricsConfiguration.DURATION_BUCKETS, "1.0, 0.5");

        QueryMetricsConfigurationException e = assertThrows(QueryMetricsConfigurationException.class,
            () -> new QueryMetricsConfiguration("default", overrides));

        assertEquals(QueryMetricsErrorCodes.INVALID_CONFIGURATION, e.getCode());
        assertTrue(e.getMessage().contains("strictly ascending"), e.getMessage());
    }

    @Test
    void testExporterOptionsWithRegistry() {
        MicrometerMetricsRegistry registry = new MicrometerMetricsRegistry(new SimpleMeterRegistry());
        QueryMetricsConfiguration config = new QueryMetricsConfiguration("test");

        QueryExporterOptions options = config.getExporterOptions(registry);

        assertSame(registry, options.getRegistry().orElseThrow());
        assertEquals("test_query_errors_total", options.getErrorCounterName());
    }

    @Test
    void testTypedGetters() {
        QueryMetricsConfiguration config = new QueryMetricsConfiguration("test");

        assertFalse(config.getBoolean(QueryMetricsConfiguration.ERRORS_LABEL, true));
        assertTrue(config.getBoolean("querymetrics.missing", true));
        assertEquals("fallback", config.getString("querymetrics.missing", "fallback"));

        config.getProperties().setProperty(QueryMetricsConfiguration.PREFIX, "mutated_");
        assertEquals("test_", config.getString(QueryMetricsConfiguration.PREFIX, null));
    }

    @Test
    void testEnvironmentLabelKeysKeepUnderscores() {
        assertEquals("querymetrics.labels.service_name",
            QueryMetricsConfiguration.environmentKeyToProperty("QUERYMETRICS_LABELS_SERVICE_NAME"));
        assertEquals("querymetrics.labels.region",
            QueryMetricsConfiguration.environmentKeyToProperty("QUERYMETRICS_LABELS_REGION"));
        assertEquals("querymetrics.errors.label",
            QueryMetricsConfiguration.environmentKeyToProperty("QUERYMETRICS_ERRORS_LABEL"));
        assertEquals("querymetrics.tracker.timeout",
            QueryMetricsConfiguration.environmentKeyToProperty("QUERYMETRICS_TRACKER_TIMEOUT"));
    }
}
