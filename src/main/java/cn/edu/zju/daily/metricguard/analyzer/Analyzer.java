package cn.edu.zju.daily.metricguard.analyzer;

import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Computes one metric in two phases: a state is read from the data (asynchronously, this is the
 * only step that waits on the query engine), then the state is finalized into a metric. States of
 * several partitions can be merged before finalizing.
 *
 * @param <S> the state this analyzer produces
 */
public interface Analyzer<S extends AnalyzerState<S>> {

    /** Analyzer name, e.g. {@code "mean"}. */
    String name();

    /** Unique key of the metric, {@code "{name}.{qualifier}"}. */
    String metricKey();

    /** Columns read by this analyzer; empty for table-level analyzers. */
    List<String> columns();

    CompletableFuture<S> computeState(ExecutionContext context);

    /** Pure finalization. Defaults to the state's own metric. */
    default MetricValue computeMetric(S state) {
        return state.toMetric();
    }

    /** Identity for {@link AnalyzerState#merge}. */
    S emptyState();

    Class<S> stateClass();
}
