package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.RatioState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/** Fraction of non-null values in a column. */
public class CompletenessAnalyzer extends AbstractAnalyzer<RatioState> {

    public static final String NAME = "completeness";

    public CompletenessAnalyzer(String column) {
        super(NAME, column, RatioState.class);
    }

    @Override
    public CompletableFuture<RatioState> computeState(ExecutionContext context) {
        Aggregate rows = Aggregate.countRows();
        Aggregate nonNull = Aggregate.of(AggregateFunction.COUNT_NON_NULL, column());
        return aggregate(context, Arrays.asList(rows, nonNull))
                .thenApply(r -> new RatioState(r.getLong(nonNull), r.getLong(rows)));
    }

    @Override
    public RatioState emptyState() {
        return RatioState.EMPTY;
    }
}
