package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.SizeState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;

/** Row count of the table. */
public class SizeAnalyzer extends AbstractAnalyzer<SizeState> {

    public static final String NAME = "size";

    public SizeAnalyzer() {
        super(NAME, null, Collections.emptyList(), SizeState.class);
    }

    @Override
    public CompletableFuture<SizeState> computeState(ExecutionContext context) {
        Aggregate rows = Aggregate.countRows();
        return aggregate(context, Collections.singletonList(rows))
                .thenApply(result -> new SizeState(result.getLong(rows)));
    }

    @Override
    public SizeState emptyState() {
        return SizeState.EMPTY;
    }
}
