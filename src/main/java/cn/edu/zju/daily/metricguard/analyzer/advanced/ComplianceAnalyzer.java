package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.RatioState;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Fraction of rows whose value satisfies a predicate. The predicate also sees nulls; the key is
 * {@code compliance.{name}}.
 */
public class ComplianceAnalyzer extends AbstractAnalyzer<RatioState> {

    public static final String NAME = "compliance";

    private final Predicate<Object> predicate;

    public ComplianceAnalyzer(String name, String column, Predicate<Object> predicate) {
        super(NAME, name, Collections.singletonList(column), RatioState.class);
        this.predicate = predicate;
    }

    @Override
    public CompletableFuture<RatioState> computeState(ExecutionContext context) {
        long[] counts = new long[2];
        return scan(
                        context,
                        row -> {
                            counts[1]++;
                            if (predicate.test(row[0])) {
                                counts[0]++;
                            }
                        })
                .thenApply(n -> new RatioState(counts[0], counts[1]));
    }

    @Override
    public RatioState emptyState() {
        return RatioState.EMPTY;
    }
}
