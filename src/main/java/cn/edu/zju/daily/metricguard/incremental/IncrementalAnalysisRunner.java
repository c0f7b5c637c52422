package cn.edu.zju.daily.metricguard.incremental;

import static cn.edu.zju.daily.metricguard.utils.FutureUtils.await;

import cn.edu.zju.daily.metricguard.analyzer.Analyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.AnalysisAbortedException;
import cn.edu.zju.daily.metricguard.core.error.MetricGuardException;
import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.error.StoreException;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import cn.edu.zju.daily.metricguard.core.state.StateCodec;
import cn.edu.zju.daily.metricguard.data.TableSchema;
import cn.edu.zju.daily.metricguard.runner.AnalysisError;
import cn.edu.zju.daily.metricguard.runner.AnalyzerContext;
import cn.edu.zju.daily.metricguard.runner.AnalyzerExecution;
import cn.edu.zju.daily.metricguard.utils.FutureUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Maintains cumulative analyzer states for a series of partitions.
 *
 * <p>Each partition's states are computed from its data and merged into the states stored under
 * the series key; the series entry also records which partitions were merged, so a partition is
 * never counted twice. Metrics are finalized only when asked for. An analyzer whose columns are
 * missing from a partition is skipped for that partition and reported as a {@link PartitionGap};
 * metrics that do not cover every processed partition are reported as partial history.
 *
 * <p>States stored under keys this runner does not know are kept as they are.
 */
@Slf4j
public class IncrementalAnalysisRunner {

    static final String DELTA_SEPARATOR = "@";

    private final StateStore store;
    private final String seriesKey;
    private final Map<String, AnalyzerExecution> executions;
    private final IncrementalConfig config;
    private final KeyedLocks locks = new KeyedLocks();

    private IncrementalAnalysisRunner(Builder builder) {
        this.store = builder.store;
        this.seriesKey = builder.seriesKey;
        this.executions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.executions));
        this.config = builder.config;
    }

    public static Builder builder(StateStore store, String seriesKey) {
        return new Builder(store, seriesKey);
    }

    /**
     * Computes the partition's states and merges them into the series.
     *
     * @throws IllegalStateException if the partition was already merged and the duplicate policy
     *     is {@link DuplicatePartitionPolicy#REJECT}
     * @throws StoreException if the series cannot be loaded or saved; the partition is then not
     *     marked as processed
     */
    public IncrementalResult processPartition(String partitionKey, ExecutionContext context) {
        if (partitionKey.isEmpty() || partitionKey.contains(DELTA_SEPARATOR)) {
            throw new IllegalArgumentException("Invalid partition key '" + partitionKey + "'");
        }
        if (loadMetadata().isProcessed(partitionKey)) {
            return duplicate(partitionKey);
        }
        long start = System.currentTimeMillis();
        Computed computed = computeStates(partitionKey, context);
        IncrementalResult result =
                locks.withLock(seriesKey, () -> mergeAndSave(partitionKey, computed));
        LOG.info(
                "Partition {} of {}: {} with {} metrics, {} gaps, {} errors in {} ms",
                partitionKey,
                seriesKey,
                result.getStatus(),
                result.getMergedMetrics().size(),
                result.getGaps().size(),
                result.getErrors().size(),
                System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Processes several partitions, up to {@code maxConcurrency} at a time. With {@code
     * continueOnError} a failed partition is reported in its result; otherwise the first failure
     * is rethrown. State shape mismatches are always rethrown.
     */
    public List<IncrementalResult> processPartitions(Map<String, ExecutionContext> partitions) {
        if (partitions.isEmpty()) {
            return Collections.emptyList();
        }
        int threads = Math.max(1, Math.min(config.getMaxConcurrency(), partitions.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            Map<String, Future<IncrementalResult>> futures = new LinkedHashMap<>();
            partitions.forEach(
                    (key, context) ->
                            futures.put(key, pool.submit(() -> processPartition(key, context))));
            List<IncrementalResult> results = new ArrayList<>();
            for (Map.Entry<String, Future<IncrementalResult>> e : futures.entrySet()) {
                try {
                    results.add(e.getValue().get());
                } catch (ExecutionException ex) {
                    RuntimeException cause = FutureUtils.unwrap(ex);
                    if (cause instanceof StateIncompatibilityException
                            || !config.isContinueOnError()) {
                        throw cause;
                    }
                    LOG.warn("Partition {} failed: {}", e.getKey(), cause.getMessage());
                    results.add(IncrementalResult.failed(e.getKey(), cause));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new MetricGuardException("Interrupted while processing partitions", ex);
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    /** Finalizes the cumulative states of all known analyzers. */
    public AnalyzerContext computeMetrics() {
        Map<String, byte[]> states = store.loadState(seriesKey).orElse(Collections.emptyMap());
        SeriesMetadata metadata = SeriesMetadata.decode(states.get(SeriesMetadata.KEY));
        AnalyzerContext.Builder result = AnalyzerContext.builder(seriesKey);
        for (AnalyzerExecution execution : executions.values()) {
            byte[] bytes = states.get(execution.metricKey());
            if (bytes != null) {
                AnalyzerState<?> state = decode(execution.metricKey(), bytes);
                result.metric(execution.metricKey(), execution.computeMetric(state));
            }
        }
        result.metadata("partitions", String.valueOf(metadata.processed().size()));
        List<String> partial = metadata.partialMetrics();
        if (!partial.isEmpty()) {
            result.metadata("partial_history", String.join(",", partial));
        }
        return result.build();
    }

    /** Finalizes the states recorded for a single partition, if deltas were recorded. */
    public Optional<AnalyzerContext> metricsForPartition(String partitionKey) {
        Optional<Map<String, byte[]>> delta = store.loadState(deltaKey(partitionKey));
        if (!delta.isPresent()) {
            return Optional.empty();
        }
        AnalyzerContext.Builder result = AnalyzerContext.builder(deltaKey(partitionKey));
        delta.get()
                .forEach(
                        (metricKey, bytes) -> {
                            AnalyzerExecution execution = executions.get(metricKey);
                            AnalyzerState<?> state = decode(metricKey, bytes);
                            result.metric(
                                    metricKey,
                                    execution == null
                                            ? state.toMetric()
                                            : execution.computeMetric(state));
                        });
        return Optional.of(result.build());
    }

    /** Deletes recorded partition deltas; the cumulative states are not affected. */
    public List<String> prune(RetentionPolicy policy) {
        List<String> recorded = recordedPartitions();
        List<String> expired = policy.select(recorded);
        for (String partition : expired) {
            String key = deltaKey(partition);
            locks.withLock(
                    key,
                    () -> {
                        store.deleteState(key);
                        return null;
                    });
        }
        LOG.info(
                "Pruned {} of {} partition deltas of {}",
                expired.size(),
                recorded.size(),
                seriesKey);
        return expired;
    }

    /** Partitions merged into the series, in processing order. */
    public List<String> processedPartitions() {
        return loadMetadata().processed();
    }

    /** Partitions whose own states are recorded. */
    public List<String> recordedPartitions() {
        String prefix = seriesKey + DELTA_SEPARATOR;
        List<String> partitions = new ArrayList<>();
        for (String key : store.listPartitions()) {
            if (key.startsWith(prefix)) {
                partitions.add(key.substring(prefix.length()));
            }
        }
        return partitions;
    }

    public List<String> partialHistory() {
        return loadMetadata().partialMetrics();
    }

    public String getSeriesKey() {
        return seriesKey;
    }

    public IncrementalConfig getConfig() {
        return config;
    }

    String deltaKey(String partitionKey) {
        return seriesKey + DELTA_SEPARATOR + partitionKey;
    }

    private Computed computeStates(String partitionKey, ExecutionContext context) {
        TableSchema schema = await(context.getEngine().schema(context.getTable()));
        Computed computed = new Computed();
        for (AnalyzerExecution execution : executions.values()) {
            List<String> missing = new ArrayList<>();
            for (String column : execution.columns()) {
                if (!schema.hasColumn(column)) {
                    missing.add(column);
                }
            }
            if (!missing.isEmpty()) {
                LOG.warn(
                        "Partition {} lacks columns {}, skipping {}",
                        partitionKey,
                        missing,
                        execution.metricKey());
                computed.gaps.add(new PartitionGap(partitionKey, execution.metricKey(), missing));
                continue;
            }
            try {
                computed.states.put(execution.metricKey(), await(execution.computeState(context)));
            } catch (StateIncompatibilityException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!config.isContinueOnError()) {
                    throw new AnalysisAbortedException(execution.metricKey(), e);
                }
                LOG.warn(
                        "Analyzer {} failed on partition {}: {}",
                        execution.metricKey(),
                        partitionKey,
                        e.getMessage());
                computed.errors.add(AnalysisError.of(execution, e));
            }
        }
        return computed;
    }

    private IncrementalResult mergeAndSave(String partitionKey, Computed computed) {
        Map<String, byte[]> series =
                new LinkedHashMap<>(store.loadState(seriesKey).orElse(Collections.emptyMap()));
        SeriesMetadata metadata = SeriesMetadata.decode(series.get(SeriesMetadata.KEY));
        if (metadata.isProcessed(partitionKey)) {
            return duplicate(partitionKey);
        }

        Map<String, byte[]> delta = new LinkedHashMap<>();
        List<String> merged = new ArrayList<>();
        for (Map.Entry<String, AnalyzerState<?>> e : computed.states.entrySet()) {
            String metricKey = e.getKey();
            AnalyzerExecution execution = executions.get(metricKey);
            byte[] existing = series.get(metricKey);
            AnalyzerState<?> state =
                    existing == null
                            ? e.getValue()
                            : execution.merge(decode(metricKey, existing), e.getValue());
            series.put(metricKey, StateCodec.encode(state));
            delta.put(metricKey, StateCodec.encode(e.getValue()));
            merged.add(metricKey);
        }
        metadata.record(partitionKey, merged);
        series.put(SeriesMetadata.KEY, metadata.encode());

        if (config.isRecordPartitionDeltas()) {
            store.saveState(deltaKey(partitionKey), delta);
        }
        store.saveState(seriesKey, series);

        List<String> partial = new ArrayList<>();
        for (String metricKey : executions.keySet()) {
            if (metadata.isPartial(metricKey)) {
                partial.add(metricKey);
            }
        }
        return new IncrementalResult(
                partitionKey,
                IncrementalResult.Status.PROCESSED,
                merged,
                computed.gaps,
                partial,
                computed.errors,
                null);
    }

    private IncrementalResult duplicate(String partitionKey) {
        if (config.getDuplicatePolicy() == DuplicatePartitionPolicy.SKIP) {
            LOG.info("Partition {} of {} already processed, skipping", partitionKey, seriesKey);
            return IncrementalResult.skipped(partitionKey);
        }
        throw new IllegalStateException(
                "Partition " + partitionKey + " of " + seriesKey + " was already processed");
    }

    private SeriesMetadata loadMetadata() {
        return SeriesMetadata.decode(
                store.loadState(seriesKey).map(s -> s.get(SeriesMetadata.KEY)).orElse(null));
    }

    private static AnalyzerState<?> decode(String metricKey, byte[] bytes) {
        try {
            return StateCodec.decode(bytes);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Corrupt state for metric " + metricKey, e);
        }
    }

    private static class Computed {
        final Map<String, AnalyzerState<?>> states = new LinkedHashMap<>();
        final List<PartitionGap> gaps = new ArrayList<>();
        final List<AnalysisError> errors = new ArrayList<>();
    }

    public static class Builder {
        private final StateStore store;
        private final String seriesKey;
        private final Map<String, AnalyzerExecution> executions = new LinkedHashMap<>();
        private IncrementalConfig config = new IncrementalConfig();

        private Builder(StateStore store, String seriesKey) {
            if (seriesKey == null || seriesKey.isEmpty() || seriesKey.contains(DELTA_SEPARATOR)) {
                throw new IllegalArgumentException("Invalid series key '" + seriesKey + "'");
            }
            this.store = store;
            this.seriesKey = seriesKey;
        }

        public Builder addAnalyzer(Analyzer<?> analyzer) {
            String key = analyzer.metricKey();
            if (SeriesMetadata.KEY.equals(key)) {
                throw new IllegalArgumentException("Metric key " + key + " is reserved");
            }
            if (executions.containsKey(key)) {
                throw new IllegalStateException("Duplicate metric key " + key);
            }
            executions.put(key, AnalyzerExecution.wrap(analyzer));
            return this;
        }

        public Builder addAnalyzers(List<? extends Analyzer<?>> analyzers) {
            for (Analyzer<?> analyzer : analyzers) {
                addAnalyzer(analyzer);
            }
            return this;
        }

        public Builder config(IncrementalConfig config) {
            this.config = config;
            return this;
        }

        public IncrementalAnalysisRunner build() {
            if (config.getMaxConcurrency() < 1) {
                throw new IllegalArgumentException("maxConcurrency must be at least 1");
            }
            return new IncrementalAnalysisRunner(this);
        }
    }
}
