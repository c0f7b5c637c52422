package cn.edu.zju.daily.metricguard.runner;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one analysis run: metrics by key, per-analyzer errors, analyzers skipped because the
 * run was cancelled, and run metadata. Metrics are ordered by key, so the result does not depend on
 * the order the analyzers ran in.
 */
@Getter
@ToString
public final class AnalyzerContext {

    private final SortedMap<String, MetricValue> metrics;
    private final List<AnalysisError> errors;
    private final List<String> cancelled;
    private final Metadata metadata;

    private AnalyzerContext(
            Map<String, MetricValue> metrics,
            List<AnalysisError> errors,
            List<String> cancelled,
            Metadata metadata) {
        this.metrics = Collections.unmodifiableSortedMap(new TreeMap<>(metrics));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.cancelled = Collections.unmodifiableList(new ArrayList<>(cancelled));
        this.metadata = metadata;
    }

    public static Builder builder(String table) {
        return new Builder(table);
    }

    public Optional<MetricValue> getMetric(String key) {
        return Optional.ofNullable(metrics.get(key));
    }

    /** Metrics whose key starts with {@code prefix}, e.g. {@code "mean."}. */
    public Map<String, MetricValue> getAnalyzerMetrics(String prefix) {
        Map<String, MetricValue> result = new LinkedHashMap<>();
        metrics.forEach(
                (k, v) -> {
                    if (k.startsWith(prefix)) {
                        result.put(k, v);
                    }
                });
        return result;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public RunStatus status() {
        if (!cancelled.isEmpty()) {
            return RunStatus.CANCELLED;
        }
        return errors.isEmpty() ? RunStatus.SUCCESS : RunStatus.COMPLETED_WITH_ERRORS;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(
                String.format(
                        "Analysis of %s: %s, %d metrics, %d errors, %d cancelled in %d ms",
                        metadata.getTable(),
                        status(),
                        metrics.size(),
                        errors.size(),
                        cancelled.size(),
                        metadata.getDuration().toMillis()));
        for (AnalysisError error : errors) {
            sb.append("\n  ")
                    .append(error.getMetricKey())
                    .append(": ")
                    .append(error.getErrorType())
                    .append(" - ")
                    .append(error.getMessage());
        }
        return sb.toString();
    }

    @Getter
    @ToString
    public static final class Metadata {
        private final String table;
        private final Instant startedAt;
        private final Instant finishedAt;
        private final Map<String, String> custom;

        Metadata(String table, Instant startedAt, Instant finishedAt, Map<String, String> custom) {
            this.table = table;
            this.startedAt = startedAt;
            this.finishedAt = finishedAt;
            this.custom = Collections.unmodifiableMap(new LinkedHashMap<>(custom));
        }

        public Duration getDuration() {
            return Duration.between(startedAt, finishedAt);
        }
    }

    public static class Builder {
        private final String table;
        private final Instant startedAt = Instant.now();
        private final Map<String, MetricValue> metrics = new LinkedHashMap<>();
        private final List<AnalysisError> errors = new ArrayList<>();
        private final List<String> cancelled = new ArrayList<>();
        private final Map<String, String> custom = new LinkedHashMap<>();

        private Builder(String table) {
            this.table = table;
        }

        public Builder metric(String key, MetricValue value) {
            if (metrics.putIfAbsent(key, value) != null) {
                throw new IllegalStateException("Metric " + key + " reported twice");
            }
            return this;
        }

        public Builder error(AnalysisError error) {
            errors.add(error);
            return this;
        }

        public Builder cancelled(String key) {
            cancelled.add(key);
            return this;
        }

        public Builder metadata(String key, String value) {
            custom.put(key, value);
            return this;
        }

        public AnalyzerContext build() {
            Metadata metadata = new Metadata(table, startedAt, Instant.now(), custom);
            return new AnalyzerContext(metrics, errors, cancelled, metadata);
        }
    }
}
