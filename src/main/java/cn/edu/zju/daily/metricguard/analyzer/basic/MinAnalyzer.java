package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.MinState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

public class MinAnalyzer extends AbstractAnalyzer<MinState> {

    public static final String NAME = "min";

    public MinAnalyzer(String column) {
        super(NAME, column, MinState.class);
    }

    @Override
    public CompletableFuture<MinState> computeState(ExecutionContext context) {
        Aggregate min = Aggregate.of(AggregateFunction.MIN, column());
        Aggregate count = Aggregate.of(AggregateFunction.COUNT_NON_NULL, column());
        return aggregate(context, Arrays.asList(min, count))
                .thenApply(
                        r -> {
                            long n = r.getLong(count);
                            return n == 0 ? MinState.EMPTY : new MinState(r.getDouble(min), n);
                        });
    }

    @Override
    public MinState emptyState() {
        return MinState.EMPTY;
    }
}
