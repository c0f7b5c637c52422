package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Counts of the most frequent values, most frequent first. Null rows are reported under {@link
 * FrequencyState#NULL_KEY} when present.
 */
public class HistogramAnalyzer extends FrequencyBasedAnalyzer {

    public static final String NAME = "histogram";
    public static final int DEFAULT_MAX_BINS = 20;

    private final int maxBins;

    public HistogramAnalyzer(String column) {
        this(column, DEFAULT_MAX_BINS);
    }

    public HistogramAnalyzer(String column, int maxBins) {
        super(NAME, Collections.singletonList(column));
        if (maxBins <= 0) {
            throw new IllegalArgumentException("maxBins must be positive, got " + maxBins);
        }
        this.maxBins = maxBins;
    }

    @Override
    public MetricValue computeMetric(FrequencyState state) {
        Map<String, Double> bins = new LinkedHashMap<>();
        for (Pair<String, Long> entry : state.top(maxBins)) {
            bins.put(entry.getLeft(), entry.getRight().doubleValue());
        }
        long nulls = state.getNumRows() - state.groupedRows();
        if (nulls > 0) {
            bins.put(FrequencyState.NULL_KEY, (double) nulls);
        }
        return MetricValue.distribution(bins);
    }

    public int getMaxBins() {
        return maxBins;
    }
}
