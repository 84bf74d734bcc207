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
package dev.mars.querymetrics.core.config;

import dev.mars.querymetrics.api.QueryExporterOptions;
import dev.mars.querymetrics.api.error.QueryMetricsConfigurationException;
import dev.mars.querymetrics.api.error.QueryMetricsErrorCodes;
import dev.mars.querymetrics.api.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Properties-based configuration for query exporters.
 *
 * <p>Sources, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>{@code /querymetrics-default.properties} on the classpath</li>
 *   <li>{@code /querymetrics-<profile>.properties} on the classpath</li>
 *   <li>{@code QUERYMETRICS_*} environment variables ({@code QUERYMETRICS_DURATION_NAME}
 *       becomes {@code querymetrics.duration.name})</li>
 *   <li>{@code querymetrics.*} system properties</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public class QueryMetricsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(QueryMetricsConfiguration.class);

    public static final String PREFIX = "querymetrics.prefix";
    public static final String DURATION_NAME = "querymetrics.duration.name";
    public static final String DURATION_BUCKETS = "querymetrics.duration.buckets";
    public static final String ERRORS_NAME = "querymetrics.errors.name";
    public static final String ERRORS_LABEL = "querymetrics.errors.label";
    public static final String LABELS_PREFIX = "querymetrics.labels.";
    public static final String TRACKER_TIMEOUT = "querymetrics.tracker.timeout";

    private final Properties properties;
    private final String profile;
    private final QueryExporterOptions exporterOptions;

    public QueryMetricsConfiguration() {
        this(getActiveProfile());
    }

    public QueryMetricsConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * @param profile the configuration profile to load
     * @param overrides properties that win over every other source
     */
    public QueryMetricsConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        this.exporterOptions = validateConfiguration();
        logger.info("Loaded query metrics configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("querymetrics.profile",
               System.getenv("QUERYMETRICS_PROFILE") != null ? System.getenv("QUERYMETRICS_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/querymetrics-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/querymetrics-" + profile + ".properties");
        }

        // Environment first, so that -D system properties win
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("QUERYMETRICS_") && !"QUERYMETRICS_PROFILE".equals(key)) {
                props.setProperty(environmentKeyToProperty(key), value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("querymetrics.") && !"querymetrics.profile".equals(keyStr)) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Maps an environment variable to its property key. Underscores become dots, except in
     * the label name after {@code QUERYMETRICS_LABELS_}, so {@code QUERYMETRICS_LABELS_SERVICE_NAME}
     * sets the label {@code service_name}.
     */
    static String environmentKeyToProperty(String key) {
        String lower = key.toLowerCase();
        String labelsEnvPrefix = LABELS_PREFIX.replace('.', '_');
        if (lower.startsWith(labelsEnvPrefix) && lower.length() > labelsEnvPrefix.length()) {
            return LABELS_PREFIX + lower.substring(labelsEnvPrefix.length());
        }
        return lower.replace("_", ".");
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private QueryExporterOptions validateConfiguration() {
        List<String> errors = new ArrayList<>();

        List<Double> buckets = parseBuckets(errors);
        Duration timeout = parseTimeout(errors);

        QueryExporterOptions options = null;
        if (errors.isEmpty()) {
            try {
                QueryExporterOptions.Builder builder = new QueryExporterOptions.Builder()
                    .namePrefix(getString(PREFIX, QueryExporterOptions.DEFAULT_NAME_PREFIX))
                    .durationMetricName(getString(DURATION_NAME, QueryExporterOptions.DEFAULT_DURATION_METRIC_NAME))
                    .bucketBoundaries(buckets)
                    .errorMetricName(getString(ERRORS_NAME, QueryExporterOptions.DEFAULT_ERROR_METRIC_NAME))
                    .includeErrorMessageLabel(getBoolean(ERRORS_LABEL, true))
                    .extraLabels(getExtraLabels())
                    .staleEntryTimeout(timeout);
                options = builder.build();
            } catch (QueryMetricsConfigurationException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INVALID_CONFIGURATION,
                "Configuration validation failed: " + String.join(", ", errors));
        }

        logger.info("Configuration validation passed");
        return options;
    }

    private List<Double> parseBuckets(List<String> errors) {
        String value = properties.getProperty(DURATION_BUCKETS);
        if (value == null || value.isBlank()) {
            return QueryExporterOptions.DEFAULT_BUCKET_BOUNDARIES;
        }
        List<Double> buckets = new ArrayList<>();
        for (String part : value.split(",")) {
            try {
                buckets.add(Double.parseDouble(part.trim()));
            } catch (NumberFormatException e) {
                errors.add("Bucket boundary '" + part.trim() + "' is not a number");
            }
        }
        return buckets;
    }

    private Duration parseTimeout(List<String> errors) {
        String value = properties.getProperty(TRACKER_TIMEOUT);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            errors.add("Tracker timeout '" + value + "' is not an ISO-8601 duration");
            return null;
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Every {@code querymetrics.labels.<name>} property, keyed by label name, sorted.
     */
    public Map<String, String> getExtraLabels() {
        Map<String, String> labels = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(LABELS_PREFIX) && key.length() > LABELS_PREFIX.length()) {
                labels.put(key.substring(LABELS_PREFIX.length()), properties.getProperty(key));
            }
        }
        return labels;
    }

    /**
     * Exporter options described by this configuration, using the implicit default registry.
     */
    public QueryExporterOptions getExporterOptions() {
        return exporterOptions;
    }

    /**
     * Exporter options described by this configuration, registering into the given registry.
     */
    public QueryExporterOptions getExporterOptions(MetricsRegistry registry) {
        return exporterOptions.toBuilder().registry(registry).build();
    }

    public String getProfile() { return profile; }
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
