package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.MaxState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

public class MaxAnalyzer extends AbstractAnalyzer<MaxState> {

    public static final String NAME = "max";

    public MaxAnalyzer(String column) {
        super(NAME, column, MaxState.class);
    }

    @Override
    public CompletableFuture<MaxState> computeState(ExecutionContext context) {
        Aggregate max = Aggregate.of(AggregateFunction.MAX, column());
        Aggregate count = Aggregate.of(AggregateFunction.COUNT_NON_NULL, column());
        return aggregate(context, Arrays.asList(max, count))
                .thenApply(
                        r -> {
                            long n = r.getLong(count);
                            return n == 0 ? MaxState.EMPTY : new MaxState(r.getDouble(max), n);
                        });
    }

    @Override
    public MaxState emptyState() {
        return MaxState.EMPTY;
    }
}
