package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import cn.edu.zju.daily.metricguard.core.state.MutualInformationState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import cn.edu.zju.daily.metricguard.data.AggregateResult;
import cn.edu.zju.daily.metricguard.data.TableSchema;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Mutual information in bits between two columns over rows where both are non-null. Numeric
 * columns are discretized into {@code bins} equal-width bins spanning the column's range in the
 * analyzed data; other columns, or all columns when {@code bins} is 0, are compared by value.
 *
 * <p>Bin edges depend on the range of each analyzed partition, so merged states are only
 * meaningful for partitions with similar ranges.
 */
public class MutualInformationAnalyzer extends AbstractAnalyzer<MutualInformationState> {

    public static final String NAME = "mutual_information";
    public static final int DEFAULT_BINS = 10;

    private final int bins;

    public MutualInformationAnalyzer(String first, String second) {
        this(first, second, DEFAULT_BINS);
    }

    public MutualInformationAnalyzer(String first, String second, int bins) {
        super(
                NAME,
                first + "_" + second,
                Arrays.asList(first, second),
                MutualInformationState.class);
        if (bins < 0) {
            throw new IllegalArgumentException("bins must not be negative");
        }
        this.bins = bins;
    }

    public int getBins() {
        return bins;
    }

    @Override
    public CompletableFuture<MutualInformationState> computeState(ExecutionContext context) {
        return context.getEngine()
                .schema(context.getTable())
                .thenCompose(schema -> discretizers(context, schema))
                .thenCompose(keys -> count(context, keys.get(0), keys.get(1)));
    }

    private CompletableFuture<List<Function<Object, String>>> discretizers(
            ExecutionContext context, TableSchema schema) {
        List<Aggregate> ranges = new ArrayList<>();
        for (String column : columns()) {
            if (bins > 0 && schema.typeOf(column).isNumeric()) {
                ranges.add(Aggregate.of(AggregateFunction.MIN, column));
                ranges.add(Aggregate.of(AggregateFunction.MAX, column));
            }
        }
        CompletableFuture<AggregateResult> bounds =
                ranges.isEmpty()
                        ? CompletableFuture.completedFuture(null)
                        : aggregate(context, ranges);
        return bounds.thenApply(
                r -> {
                    List<Function<Object, String>> keys = new ArrayList<>();
                    for (String column : columns()) {
                        if (bins > 0 && schema.typeOf(column).isNumeric()) {
                            double min = r.getDouble(Aggregate.of(AggregateFunction.MIN, column));
                            double max = r.getDouble(Aggregate.of(AggregateFunction.MAX, column));
                            keys.add(v -> Integer.toString(bin(numeric(v, column), min, max)));
                        } else {
                            keys.add(HashUtils::canonical);
                        }
                    }
                    return keys;
                });
    }

    private CompletableFuture<MutualInformationState> count(
            ExecutionContext context,
            Function<Object, String> firstKey,
            Function<Object, String> secondKey) {
        Map<String, Long> joint = new HashMap<>();
        Map<String, Long> first = new HashMap<>();
        Map<String, Long> second = new HashMap<>();
        return scan(
                        context,
                        row -> {
                            if (row[0] != null && row[1] != null) {
                                String x = firstKey.apply(row[0]);
                                String y = secondKey.apply(row[1]);
                                joint.merge(MutualInformationState.pairKey(x, y), 1L, Long::sum);
                                first.merge(x, 1L, Long::sum);
                                second.merge(y, 1L, Long::sum);
                            }
                        })
                .thenApply(
                        n ->
                                new MutualInformationState(
                                        new FrequencyState(joint, n),
                                        new FrequencyState(first, n),
                                        new FrequencyState(second, n),
                                        bins));
    }

    /** Equal-width bin of {@code value}; the maximum falls into the last bin. */
    int bin(double value, double min, double max) {
        double width = max > min ? (max - min) / bins : 1d;
        int index = (int) Math.floor((value - min) / width);
        return Math.max(0, Math.min(bins - 1, index));
    }

    @Override
    public MutualInformationState emptyState() {
        return MutualInformationState.empty(bins);
    }
}
