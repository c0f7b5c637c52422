package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.StandardDeviationState;
import java.util.concurrent.CompletableFuture;

/** Population standard deviation of the non-null values, accumulated in one scan. */
public class StandardDeviationAnalyzer extends AbstractAnalyzer<StandardDeviationState> {

    public static final String NAME = "standard_deviation";

    public StandardDeviationAnalyzer(String column) {
        super(NAME, column, StandardDeviationState.class);
    }

    @Override
    public CompletableFuture<StandardDeviationState> computeState(ExecutionContext context) {
        StandardDeviationState.Accumulator acc = new StandardDeviationState.Accumulator();
        return scan(
                        context,
                        row -> {
                            if (row[0] != null) {
                                acc.add(numeric(row[0], column()));
                            }
                        })
                .thenApply(rows -> acc.toState());
    }

    @Override
    public StandardDeviationState emptyState() {
        return StandardDeviationState.EMPTY;
    }
}
