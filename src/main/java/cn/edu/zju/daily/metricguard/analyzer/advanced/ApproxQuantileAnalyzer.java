package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.sketch.KllSketch;
import cn.edu.zju.daily.metricguard.sketch.KllSketchState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/** Approximate quantiles of a numeric column from a KLL sketch, named like {@code "0.5"}. */
public class ApproxQuantileAnalyzer extends AbstractAnalyzer<KllSketchState> {

    public static final String NAME = "approx_quantile";
    public static final double[] DEFAULT_QUANTILES = {0.25, 0.5, 0.75};

    private final double[] quantiles;
    private final int k;
    private final long seed;

    public ApproxQuantileAnalyzer(String column) {
        this(column, DEFAULT_QUANTILES, KllSketch.DEFAULT_K, 0L);
    }

    public ApproxQuantileAnalyzer(String column, double[] quantiles, int k, long seed) {
        super(NAME, column, KllSketchState.class);
        if (quantiles.length == 0) {
            throw new IllegalArgumentException("At least one quantile is required");
        }
        for (double q : quantiles) {
            if (q < 0 || q > 1) {
                throw new IllegalArgumentException("Quantile must be in [0, 1], got " + q);
            }
        }
        if (k < KllSketch.MIN_K) {
            throw new IllegalArgumentException("k must be at least " + KllSketch.MIN_K);
        }
        this.quantiles = quantiles.clone();
        this.k = k;
        this.seed = seed;
    }

    @Override
    public CompletableFuture<KllSketchState> computeState(ExecutionContext context) {
        KllSketch sketch = new KllSketch(k, new Random(seed));
        return scan(
                        context,
                        row -> {
                            if (row[0] != null) {
                                sketch.update(numeric(row[0], column()));
                            }
                        })
                .thenApply(n -> sketch.snapshot());
    }

    @Override
    public MetricValue computeMetric(KllSketchState state) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (double q : quantiles) {
            values.put(Double.toString(q), state.quantile(q));
        }
        return MetricValue.distribution(values);
    }

    @Override
    public KllSketchState emptyState() {
        return KllSketchState.empty(k, seed);
    }
}
