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
package dev.mars.querymetrics.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.querymetrics.api.error.QueryMetricsConfigurationException;
import dev.mars.querymetrics.api.error.QueryMetricsErrorCodes;
import dev.mars.querymetrics.api.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Options for attaching a query exporter to a database client.
 *
 * Controls metric naming, histogram buckets, label dimensions and the registry the
 * instruments are registered into. All options have defaults; an exporter built from
 * {@code new QueryExporterOptions.Builder().build()} exposes
 * {@code knex_query_duration_seconds} and {@code knex_query_errors_total}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-22
 * @version 1.0
 */
public final class QueryExporterOptions {

    public static final String DEFAULT_NAME_PREFIX = "knex_";
    public static final String DEFAULT_DURATION_METRIC_NAME = "query_duration_seconds";
    public static final String DEFAULT_ERROR_METRIC_NAME = "query_errors_total";
    public static final List<Double> DEFAULT_BUCKET_BOUNDARIES =
        List.of(0.003, 0.03, 0.1, 0.3, 1.5, 10.0);

    /** Label carrying the failing query's error message. */
    public static final String ERROR_LABEL = "error";

    static final String DURATION_HELP = "histogram of query responses";
    static final String ERROR_HELP = "counter of query errors";

    private static final Pattern METRIC_NAME = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");
    private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final MetricsRegistry registry;
    private final String namePrefix;
    private final String durationMetricName;
    private final List<Double> bucketBoundaries;
    private final String errorMetricName;
    private final boolean includeErrorMessageLabel;
    private final Map<String, String> extraLabels;
    private final Duration staleEntryTimeout;

    private QueryExporterOptions(Builder builder) {
        this.registry = builder.registry;
        this.namePrefix = builder.namePrefix;
        this.durationMetricName = builder.durationMetricName;
        this.bucketBoundaries = Collections.unmodifiableList(new ArrayList<>(builder.bucketBoundaries));
        this.errorMetricName = builder.errorMetricName;
        this.includeErrorMessageLabel = builder.includeErrorMessageLabel;
        this.extraLabels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraLabels));
        this.staleEntryTimeout = builder.staleEntryTimeout;
        validate();
    }

    /**
     * Creates options from their JSON representation. Absent properties keep their defaults.
     * The registry cannot be expressed in JSON and is always the implicit default.
     */
    @JsonCreator
    public static QueryExporterOptions fromJson(
            @JsonProperty("namePrefix") String namePrefix,
            @JsonProperty("durationMetricName") String durationMetricName,
            @JsonProperty("bucketBoundaries") List<Double> bucketBoundaries,
            @JsonProperty("errorMetricName") String errorMetricName,
            @JsonProperty("includeErrorMessageLabel") Boolean includeErrorMessageLabel,
            @JsonProperty("extraLabels") Map<String, String> extraLabels,
            @JsonProperty("staleEntryTimeoutMillis") Long staleEntryTimeoutMillis) {
        Builder builder = new Builder();
        if (namePrefix != null) {
            builder.namePrefix(namePrefix);
        }
        if (durationMetricName != null) {
            builder.durationMetricName(durationMetricName);
        }
        if (bucketBoundaries != null) {
            builder.bucketBoundaries(bucketBoundaries);
        }
        if (errorMetricName != null) {
            builder.errorMetricName(errorMetricName);
        }
        if (includeErrorMessageLabel != null) {
            builder.includeErrorMessageLabel(includeErrorMessageLabel);
        }
        if (extraLabels != null) {
            builder.extraLabels(extraLabels);
        }
        if (staleEntryTimeoutMillis != null) {
            builder.staleEntryTimeout(Duration.ofMillis(staleEntryTimeoutMillis));
        }
        return builder.build();
    }

    public static QueryExporterOptions defaults() {
        return new Builder().build();
    }

    private void validate() {
        List<String> errors = new ArrayList<>();

        validateMetricName(getDurationHistogramName(), errors);
        validateMetricName(getErrorCounterName(), errors);
        if (getDurationHistogramName().equals(getErrorCounterName())) {
            errors.add("Duration and error metrics must have different names");
        }
        if (!errors.isEmpty()) {
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INVALID_METRIC_NAME,
                "Invalid metric naming: " + String.join(", ", errors));
        }

        validateBuckets(errors);
        if (!errors.isEmpty()) {
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INVALID_BUCKETS,
                "Invalid bucket boundaries " + bucketBoundaries + ": " + String.join(", ", errors));
        }

        validateLabels(errors);
        if (!errors.isEmpty()) {
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INVALID_LABEL,
                "Invalid extra labels: " + String.join(", ", errors));
        }

        if (staleEntryTimeout != null && (staleEntryTimeout.isNegative() || staleEntryTimeout.isZero())) {
            throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INVALID_CONFIGURATION,
                "Stale entry timeout must be positive, found " + staleEntryTimeout);
        }
    }

    private static void validateMetricName(String name, List<String> errors) {
        if (!METRIC_NAME.matcher(name).matches()) {
            errors.add("'" + name + "' is not a valid metric name");
        }
    }

    private void validateBuckets(List<String> errors) {
        if (bucketBoundaries.isEmpty()) {
            errors.add("at least one bucket is required");
            return;
        }
        double previous = 0.0;
        for (Double boundary : bucketBoundaries) {
            if (boundary == null || boundary.isNaN() || boundary.isInfinite()) {
                errors.add("bucket boundaries must be finite numbers");
                return;
            }
            if (boundary <= 0.0) {
                errors.add("bucket boundaries must be positive");
                return;
            }
            if (boundary <= previous) {
                errors.add("bucket boundaries must be strictly ascending");
                return;
            }
            previous = boundary;
        }
    }

    private void validateLabels(List<String> errors) {
        for (Map.Entry<String, String> label : extraLabels.entrySet()) {
            String name = label.getKey();
            if (name == null || !LABEL_NAME.matcher(name).matches()) {
                errors.add("'" + name + "' is not a valid label name");
            } else if (name.startsWith("__")) {
                errors.add("label names starting with '__' are reserved");
            } else if ("le".equals(name)) {
                errors.add("'le' is reserved for histogram buckets");
            } else if (includeErrorMessageLabel && ERROR_LABEL.equals(name)) {
                errors.add("'error' is reserved for the error message label");
            }
            if (label.getValue() == null) {
                errors.add("label '" + name + "' has no value");
            }
        }
    }

    /**
     * The registry supplied by the caller, empty when the exporter should create its own.
     */
    @JsonIgnore
    public Optional<MetricsRegistry> getRegistry() {
        return Optional.ofNullable(registry);
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public String getDurationMetricName() {
        return durationMetricName;
    }

    public List<Double> getBucketBoundaries() {
        return bucketBoundaries;
    }

    public String getErrorMetricName() {
        return errorMetricName;
    }

    public boolean isIncludeErrorMessageLabel() {
        return includeErrorMessageLabel;
    }

    public Map<String, String> getExtraLabels() {
        return extraLabels;
    }

    @JsonIgnore
    public Optional<Duration> getStaleEntryTimeout() {
        return Optional.ofNullable(staleEntryTimeout);
    }

    @JsonProperty("staleEntryTimeoutMillis")
    Long getStaleEntryTimeoutMillis() {
        return staleEntryTimeout != null ? staleEntryTimeout.toMillis() : null;
    }

    @JsonIgnore
    public String getDurationHistogramName() {
        return namePrefix + durationMetricName;
    }

    @JsonIgnore
    public String getErrorCounterName() {
        return namePrefix + errorMetricName;
    }

    @JsonIgnore
    public String getDurationHistogramHelp() {
        return DURATION_HELP;
    }

    @JsonIgnore
    public String getErrorCounterHelp() {
        return includeErrorMessageLabel ? ERROR_HELP + " with labels: " + ERROR_LABEL : ERROR_HELP;
    }

    /**
     * Returns a builder pre-populated with these options.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
            .namePrefix(namePrefix)
            .durationMetricName(durationMetricName)
            .bucketBoundaries(bucketBoundaries)
            .errorMetricName(errorMetricName)
            .includeErrorMessageLabel(includeErrorMessageLabel)
            .extraLabels(extraLabels)
            .staleEntryTimeout(staleEntryTimeout);
        return builder.registry(registry);
    }

    @Override
    public String toString() {
        return "QueryExporterOptions{" +
            "registry=" + (registry != null ? registry.getClass().getSimpleName() : "default") +
            ", namePrefix='" + namePrefix + '\'' +
            ", durationMetricName='" + durationMetricName + '\'' +
            ", bucketBoundaries=" + bucketBoundaries +
            ", errorMetricName='" + errorMetricName + '\'' +
            ", includeErrorMessageLabel=" + includeErrorMessageLabel +
            ", extraLabels=" + extraLabels +
            ", staleEntryTimeout=" + staleEntryTimeout +
            '}';
    }

    /**
     * Builder for QueryExporterOptions.
     */
    public static final class Builder {
        private MetricsRegistry registry;
        private String namePrefix = DEFAULT_NAME_PREFIX;
        private String durationMetricName = DEFAULT_DURATION_METRIC_NAME;
        private List<Double> bucketBoundaries = DEFAULT_BUCKET_BOUNDARIES;
        private String errorMetricName = DEFAULT_ERROR_METRIC_NAME;
        private boolean includeErrorMessageLabel = true;
        private Map<String, String> extraLabels = new LinkedHashMap<>();
        private Duration staleEntryTimeout;

        /**
         * Registry to register the instruments into. When not set, the exporter creates a
         * Prometheus-backed registry and hands it back to the caller.
         */
        public Builder registry(MetricsRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Prefix prepended to both metric names. Use {@code ""} for plain names.
         */
        public Builder namePrefix(String namePrefix) {
            this.namePrefix = namePrefix != null ? namePrefix : "";
            return this;
        }

        public Builder durationMetricName(String durationMetricName) {
            this.durationMetricName = durationMetricName;
            return this;
        }

        /**
         * Upper bounds of the duration buckets in seconds, strictly ascending.
         */
        public Builder bucketBoundaries(List<Double> bucketBoundaries) {
            this.bucketBoundaries = new ArrayList<>(bucketBoundaries);
            return this;
        }

        public Builder bucketBoundaries(double... bucketBoundaries) {
            List<Double> boundaries = new ArrayList<>(bucketBoundaries.length);
            for (double boundary : bucketBoundaries) {
                boundaries.add(boundary);
            }
            this.bucketBoundaries = boundaries;
            return this;
        }

        public Builder errorMetricName(String errorMetricName) {
            this.errorMetricName = errorMetricName;
            return this;
        }

        /**
         * Whether each error increment carries an {@code error} label holding the failure's
         * message. When disabled, all errors are counted in a single series.
         */
        public Builder includeErrorMessageLabel(boolean includeErrorMessageLabel) {
            this.includeErrorMessageLabel = includeErrorMessageLabel;
            return this;
        }

        /**
         * Fixed labels applied to every observation and increment.
         */
        public Builder extraLabels(Map<String, String> extraLabels) {
            this.extraLabels = new LinkedHashMap<>(extraLabels);
            return this;
        }

        public Builder extraLabel(String name, String value) {
            this.extraLabels.put(name, value);
            return this;
        }

        /**
         * Evicts in-flight entries whose terminal event did not arrive within the timeout.
         * Disabled when null (the default).
         */
        public Builder staleEntryTimeout(Duration staleEntryTimeout) {
            this.staleEntryTimeout = staleEntryTimeout;
            return this;
        }

        /**
         * @throws QueryMetricsConfigurationException if any option is invalid
         */
        public QueryExporterOptions build() {
            if (durationMetricName == null || errorMetricName == null || bucketBoundaries == null) {
                throw new QueryMetricsConfigurationException(QueryMetricsErrorCodes.INVALID_CONFIGURATION,
                    "Metric names and bucket boundaries must not be null");
            }
            return new QueryExporterOptions(this);
        }
    }
}
