package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.StateCodec;
import cn.edu.zju.daily.metricguard.sketch.HyperLogLog;
import cn.edu.zju.daily.metricguard.sketch.HyperLogLogState;
import java.util.concurrent.CompletableFuture;

/**
 * Approximate distinct count with HyperLogLog. With {@code emitSketch} the metric is the encoded
 * sketch itself so that it can be merged later.
 */
public class ApproxCountDistinctAnalyzer extends AbstractAnalyzer<HyperLogLogState> {

    public static final String NAME = "approx_count_distinct";
    public static final String SKETCH_TYPE = "hll";

    private final int precision;
    private final int seed;
    private final boolean emitSketch;

    public ApproxCountDistinctAnalyzer(String column) {
        this(column, HyperLogLog.DEFAULT_PRECISION, HyperLogLog.DEFAULT_SEED, false);
    }

    public ApproxCountDistinctAnalyzer(
            String column, int precision, int seed, boolean emitSketch) {
        super(NAME, column, HyperLogLogState.class);
        this.precision = precision;
        this.seed = seed;
        this.emitSketch = emitSketch;
        // fail early on a bad precision
        HyperLogLogState.empty(precision, seed);
    }

    @Override
    public CompletableFuture<HyperLogLogState> computeState(ExecutionContext context) {
        HyperLogLog hll = new HyperLogLog(precision, seed);
        return scan(context, row -> hll.add(row[0])).thenApply(n -> hll.snapshot());
    }

    @Override
    public MetricValue computeMetric(HyperLogLogState state) {
        if (emitSketch) {
            return MetricValue.sketch(SKETCH_TYPE, StateCodec.encode(state));
        }
        return state.toMetric();
    }

    @Override
    public HyperLogLogState emptyState() {
        return HyperLogLogState.empty(precision, seed);
    }
}
