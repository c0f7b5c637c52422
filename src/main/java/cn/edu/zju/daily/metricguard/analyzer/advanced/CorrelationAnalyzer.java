package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.CorrelationState;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/** Pearson correlation of two numeric columns over rows where both are non-null. */
public class CorrelationAnalyzer extends AbstractAnalyzer<CorrelationState> {

    public static final String NAME = "correlation";

    public CorrelationAnalyzer(String first, String second) {
        super(NAME, first + "_" + second, Arrays.asList(first, second), CorrelationState.class);
    }

    @Override
    public CompletableFuture<CorrelationState> computeState(ExecutionContext context) {
        CoMoments acc = new CoMoments();
        String first = columns().get(0);
        String second = columns().get(1);
        return scan(
                        context,
                        row -> {
                            if (row[0] != null && row[1] != null) {
                                acc.add(numeric(row[0], first), numeric(row[1], second));
                            }
                        })
                .thenApply(
                        n ->
                                new CorrelationState(
                                        acc.n, acc.xMean, acc.yMean, acc.c, acc.xM2, acc.yM2));
    }

    @Override
    public CorrelationState emptyState() {
        return CorrelationState.EMPTY;
    }

    private static class CoMoments {
        long n;
        double xMean;
        double yMean;
        double c;
        double xM2;
        double yM2;

        void add(double x, double y) {
            n++;
            double dx = x - xMean;
            xMean += dx / n;
            double dy = y - yMean;
            yMean += dy / n;
            c += dx * (y - yMean);
            xM2 += dx * (x - xMean);
            yM2 += dy * (y - yMean);
        }
    }
}
