package cn.edu.zju.daily.metricguard.runner;

import static cn.edu.zju.daily.metricguard.utils.FutureUtils.await;

import cn.edu.zju.daily.metricguard.analyzer.Analyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.AnalysisAbortedException;
import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleConsumer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Runs analyzers one at a time against a table and collects their metrics.
 *
 * <p>By default a failing analyzer is recorded and the run goes on; with {@code
 * continueOnError(false)} the first failure aborts the run with an {@link
 * AnalysisAbortedException}. State shape mismatches always abort. The progress callback receives
 * {@code completed / total} after every analyzer, and its own failures are logged and ignored. The
 * cancellation token is checked before each analyzer.
 */
@Slf4j
public class AnalysisRunner {

    private final List<AnalyzerExecution> executions;
    private final boolean continueOnError;
    private final DoubleConsumer progressCallback;
    private final CancellationToken cancellationToken;

    private AnalysisRunner(Builder builder) {
        this.executions =
                Collections.unmodifiableList(new ArrayList<>(builder.executions.values()));
        this.continueOnError = builder.continueOnError;
        this.progressCallback = builder.progressCallback;
        this.cancellationToken = builder.cancellationToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<AnalyzerExecution> getExecutions() {
        return executions;
    }

    public AnalyzerContext run(ExecutionContext context) {
        LOG.info("Running {} analyzers on {}", executions.size(), context.getTable());
        AnalyzerContext.Builder result = AnalyzerContext.builder(context.getTable());
        int total = executions.size();
        for (int i = 0; i < total; i++) {
            AnalyzerExecution execution = executions.get(i);
            if (cancellationToken != null && cancellationToken.isCancelled()) {
                LOG.info("Analysis cancelled, {} analyzers not run", total - i);
                for (int j = i; j < total; j++) {
                    result.cancelled(executions.get(j).metricKey());
                }
                break;
            }
            try {
                Pair<String, MetricValue> metric = await(execution.run(context));
                result.metric(metric.getKey(), metric.getValue());
                LOG.debug("{} = {}", metric.getKey(), metric.getValue());
            } catch (StateIncompatibilityException e) {
                LOG.error("Analyzer {} produced an incompatible state", execution.metricKey(), e);
                throw e;
            } catch (RuntimeException e) {
                if (!continueOnError) {
                    LOG.error("Analyzer {} failed, aborting run", execution.metricKey(), e);
                    throw new AnalysisAbortedException(execution.metricKey(), e);
                }
                LOG.warn("Analyzer {} failed: {}", execution.metricKey(), e.getMessage());
                result.error(AnalysisError.of(execution, e));
            }
            reportProgress((double) (i + 1) / total);
        }
        AnalyzerContext analyzed = result.build();
        LOG.info(
                "Analysis of {} finished with status {} in {} ms",
                context.getTable(),
                analyzed.status(),
                analyzed.getMetadata().getDuration().toMillis());
        return analyzed;
    }

    private void reportProgress(double progress) {
        if (progressCallback == null) {
            return;
        }
        try {
            progressCallback.accept(progress);
        } catch (RuntimeException e) {
            LOG.warn("Progress callback failed at {}", progress, e);
        }
    }

    public static class Builder {
        private final Map<String, AnalyzerExecution> executions = new LinkedHashMap<>();
        private boolean continueOnError = true;
        private DoubleConsumer progressCallback;
        private CancellationToken cancellationToken;

        /**
         * @throws IllegalStateException if another analyzer already uses the same metric key
         */
        public Builder addAnalyzer(Analyzer<?> analyzer) {
            String key = analyzer.metricKey();
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

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder onProgress(DoubleConsumer progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public AnalysisRunner build() {
            return new AnalysisRunner(this);
        }
    }
}
