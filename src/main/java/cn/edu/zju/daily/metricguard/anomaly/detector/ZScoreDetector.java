package cn.edu.zju.daily.metricguard.anomaly.detector;

import cn.edu.zju.daily.metricguard.anomaly.Anomaly;
import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import cn.edu.zju.daily.metricguard.anomaly.Severity;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Flags a value more than {@code threshold} standard deviations from the historical mean. The
 * confidence is {@code 2 * Phi(|z|) - 1}, the probability mass a normal history puts closer to
 * the mean than the current value.
 */
public class ZScoreDetector extends AbstractDetector {

    public static final String NAME = "z_score";
    public static final int DEFAULT_MIN_HISTORY_SIZE = 10;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private final double threshold;

    public ZScoreDetector(double threshold) {
        this(threshold, DEFAULT_MIN_HISTORY_SIZE);
    }

    public ZScoreDetector(double threshold, int minHistorySize) {
        super(NAME, Math.max(2, minHistorySize));
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
    }

    @Override
    protected DetectionResult evaluate(String metricName, List<Double> history, double current) {
        SummaryStatistics stats = new SummaryStatistics();
        for (double v : history) {
            stats.addValue(v);
        }
        double mean = stats.getMean();
        // population deviation, like the history is the whole reference set
        double stddev = Math.sqrt(stats.getPopulationVariance());
        if (stddev == 0) {
            return current == mean
                    ? DetectionResult.normal()
                    : DetectionResult.insufficientData("history has zero variance");
        }
        double z = (current - mean) / stddev;
        if (Math.abs(z) <= threshold) {
            return DetectionResult.normal();
        }
        double confidence = 2 * STANDARD_NORMAL.cumulativeProbability(Math.abs(z)) - 1;
        return DetectionResult.anomaly(
                new Anomaly(
                        metricName,
                        NAME,
                        current,
                        mean,
                        mean - threshold * stddev,
                        mean + threshold * stddev,
                        Severity.fromRatio(Math.abs(z) / threshold),
                        confidence,
                        String.format(
                                "Value is %.2f standard deviations from mean %.4f (threshold %.1f)",
                                Math.abs(z), mean, threshold)));
    }
}
