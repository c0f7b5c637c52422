package cn.edu.zju.daily.metricguard.anomaly.detector;

import cn.edu.zju.daily.metricguard.anomaly.Anomaly;
import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import cn.edu.zju.daily.metricguard.anomaly.Severity;
import cn.edu.zju.daily.metricguard.anomaly.baseline.Baseline;
import cn.edu.zju.daily.metricguard.anomaly.baseline.MeanBaseline;
import java.util.List;

/**
 * Flags a value whose signed relative change from the baseline, {@code (current - baseline) /
 * |baseline|}, rises above {@code maxIncrease} or falls below {@code -maxDecrease}. Either limit
 * may be left unset (null) to ignore that direction, but not both. A zero baseline gives no
 * relative scale, so the detector abstains.
 */
public class RelativeRateOfChangeDetector extends AbstractDetector {

    public static final String NAME = "relative_rate_of_change";

    private final Double maxIncrease;
    private final Double maxDecrease;
    private final Baseline baseline;

    public RelativeRateOfChangeDetector(double maxRateOfChange) {
        this(maxRateOfChange, new MeanBaseline(), 1);
    }

    public RelativeRateOfChangeDetector(
            double maxRateOfChange, Baseline baseline, int minHistorySize) {
        this(maxRateOfChange, maxRateOfChange, baseline, minHistorySize);
    }

    public RelativeRateOfChangeDetector(
            Double maxIncrease, Double maxDecrease, Baseline baseline, int minHistorySize) {
        super(NAME, minHistorySize);
        if (maxIncrease == null && maxDecrease == null) {
            throw new IllegalArgumentException("Set at least one of maxIncrease, maxDecrease");
        }
        checkLimit(maxIncrease, "maxIncrease");
        checkLimit(maxDecrease, "maxDecrease");
        this.maxIncrease = maxIncrease;
        this.maxDecrease = maxDecrease;
        this.baseline = baseline;
    }

    /** Separate limits per direction against the mean of the history. */
    public static RelativeRateOfChangeDetector asymmetric(Double maxIncrease, Double maxDecrease) {
        return new RelativeRateOfChangeDetector(maxIncrease, maxDecrease, new MeanBaseline(), 1);
    }

    private static void checkLimit(Double limit, String name) {
        if (limit != null && !(limit > 0)) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public Double getMaxIncrease() {
        return maxIncrease;
    }

    public Double getMaxDecrease() {
        return maxDecrease;
    }

    @Override
    protected DetectionResult evaluate(String metricName, List<Double> history, double current) {
        double expected = baseline.compute(history);
        if (expected == 0) {
            return DetectionResult.insufficientData("baseline is zero");
        }
        double scale = Math.abs(expected);
        double rate = (current - expected) / scale;
        Double limit = rate >= 0 ? maxIncrease : maxDecrease;
        if (limit == null || Math.abs(rate) <= limit) {
            return DetectionResult.normal();
        }
        double lower =
                maxDecrease == null ? Double.NEGATIVE_INFINITY : expected - scale * maxDecrease;
        double upper =
                maxIncrease == null ? Double.POSITIVE_INFINITY : expected + scale * maxIncrease;
        double ratio = Math.abs(rate) / limit;
        return DetectionResult.anomaly(
                new Anomaly(
                        metricName,
                        NAME,
                        current,
                        expected,
                        lower,
                        upper,
                        Severity.fromRatio(ratio),
                        confidenceOf(ratio),
                        String.format(
                                "Relative %s of %.1f%% from %s %.4f exceeds %.1f%%",
                                rate >= 0 ? "increase" : "decrease",
                                Math.abs(rate) * 100,
                                baseline.describe(),
                                expected,
                                limit * 100)));
    }
}
