package cn.edu.zju.daily.metricguard.runner;

import cn.edu.zju.daily.metricguard.analyzer.Analyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.tuple.Pair;

/**
 * An analyzer with its state type hidden, so that analyzers of different state types can be held in
 * one collection. Each instance still checks the states it is handed against its own state class.
 */
public final class AnalyzerExecution {

    private final Typed<?> typed;

    private AnalyzerExecution(Typed<?> typed) {
        this.typed = typed;
    }

    public static <S extends AnalyzerState<S>> AnalyzerExecution of(Analyzer<S> analyzer) {
        return new AnalyzerExecution(new Typed<>(analyzer));
    }

    /** Same as {@link #of} for an analyzer whose state type is not known statically. */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static AnalyzerExecution wrap(Analyzer<?> analyzer) {
        return of((Analyzer) analyzer);
    }

    public String name() {
        return typed.analyzer.name();
    }

    public String metricKey() {
        return typed.analyzer.metricKey();
    }

    public List<String> columns() {
        return typed.analyzer.columns();
    }

    public Analyzer<?> analyzer() {
        return typed.analyzer;
    }

    /** Computes the state and finalizes it into {@code (metric key, metric)}. */
    public CompletableFuture<Pair<String, MetricValue>> run(ExecutionContext context) {
        return typed.run(context);
    }

    public CompletableFuture<AnalyzerState<?>> computeState(ExecutionContext context) {
        return typed.computeState(context);
    }

    public MetricValue computeMetric(AnalyzerState<?> state) {
        return typed.computeMetric(state);
    }

    public AnalyzerState<?> merge(AnalyzerState<?> left, AnalyzerState<?> right) {
        return typed.merge(left, right);
    }

    public AnalyzerState<?> emptyState() {
        return typed.analyzer.emptyState();
    }

    @Override
    public String toString() {
        return "AnalyzerExecution(" + metricKey() + ")";
    }

    private static final class Typed<S extends AnalyzerState<S>> {
        private final Analyzer<S> analyzer;

        Typed(Analyzer<S> analyzer) {
            this.analyzer = analyzer;
        }

        CompletableFuture<Pair<String, MetricValue>> run(ExecutionContext context) {
            return analyzer.computeState(context)
                    .thenApply(
                            state -> Pair.of(analyzer.metricKey(), analyzer.computeMetric(state)));
        }

        CompletableFuture<AnalyzerState<?>> computeState(ExecutionContext context) {
            return analyzer.computeState(context).thenApply(state -> state);
        }

        MetricValue computeMetric(AnalyzerState<?> state) {
            return analyzer.computeMetric(cast(state));
        }

        AnalyzerState<?> merge(AnalyzerState<?> left, AnalyzerState<?> right) {
            return cast(left).merge(cast(right));
        }

        private S cast(AnalyzerState<?> state) {
            Class<S> stateClass = analyzer.stateClass();
            if (!stateClass.isInstance(state)) {
                throw new StateIncompatibilityException(
                        analyzer.metricKey()
                                + " expects "
                                + stateClass.getSimpleName()
                                + " but got "
                                + (state == null ? "null" : state.getClass().getSimpleName()));
            }
            return stateClass.cast(state);
        }
    }
}
