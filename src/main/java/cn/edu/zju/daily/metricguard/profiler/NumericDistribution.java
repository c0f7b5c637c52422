package cn.edu.zju.daily.metricguard.profiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Distribution of a numeric column. Quantiles come from a KLL sketch and are keyed like {@code
 * "p50"}. Values outside {@code [q1 - m * IQR, q3 + m * IQR]} are counted as outliers; the count is
 * estimated from the sketch's ranks.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NumericDistribution {

    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double stddev;
    private final double variance;
    private final Map<String, Double> quantiles;
    private final double lowerFence;
    private final double upperFence;
    private final long outlierCount;

    public NumericDistribution(
            long count,
            double min,
            double max,
            double mean,
            double stddev,
            double variance,
            Map<String, Double> quantiles,
            double lowerFence,
            double upperFence,
            long outlierCount) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.stddev = stddev;
        this.variance = variance;
        this.quantiles = Collections.unmodifiableMap(new LinkedHashMap<>(quantiles));
        this.lowerFence = lowerFence;
        this.upperFence = upperFence;
        this.outlierCount = outlierCount;
    }

    public static String quantileName(double q) {
        double percent = q * 100;
        if (percent == Math.rint(percent)) {
            return "p" + (long) percent;
        }
        return "p" + percent;
    }

    public boolean isOutlier(double value) {
        return value < lowerFence || value > upperFence;
    }
}
