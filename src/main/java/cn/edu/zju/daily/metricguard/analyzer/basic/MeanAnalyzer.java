package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.MeanState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/** Mean of the non-null values; NaN for a column without values. */
public class MeanAnalyzer extends AbstractAnalyzer<MeanState> {

    public static final String NAME = "mean";

    public MeanAnalyzer(String column) {
        super(NAME, column, MeanState.class);
    }

    @Override
    public CompletableFuture<MeanState> computeState(ExecutionContext context) {
        Aggregate sum = Aggregate.of(AggregateFunction.SUM, column());
        Aggregate count = Aggregate.of(AggregateFunction.COUNT_NON_NULL, column());
        return aggregate(context, Arrays.asList(sum, count))
                .thenApply(
                        r -> {
                            long n = r.getLong(count);
                            return new MeanState(n == 0 ? 0d : r.getDouble(sum), n);
                        });
    }

    @Override
    public MeanState emptyState() {
        return MeanState.EMPTY;
    }
}
