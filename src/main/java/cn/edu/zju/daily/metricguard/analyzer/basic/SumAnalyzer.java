package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.SumState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

public class SumAnalyzer extends AbstractAnalyzer<SumState> {

    public static final String NAME = "sum";

    public SumAnalyzer(String column) {
        super(NAME, column, SumState.class);
    }

    @Override
    public CompletableFuture<SumState> computeState(ExecutionContext context) {
        Aggregate sum = Aggregate.of(AggregateFunction.SUM, column());
        Aggregate count = Aggregate.of(AggregateFunction.COUNT_NON_NULL, column());
        return aggregate(context, Arrays.asList(sum, count))
                .thenApply(
                        r -> {
                            long n = r.getLong(count);
                            return new SumState(n == 0 ? 0d : r.getDouble(sum), n);
                        });
    }

    @Override
    public SumState emptyState() {
        return SumState.EMPTY;
    }
}
