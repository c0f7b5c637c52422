package cn.edu.zju.daily.metricguard.anomaly.detector;

import cn.edu.zju.daily.metricguard.anomaly.Anomaly;
import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import cn.edu.zju.daily.metricguard.anomaly.Severity;
import cn.edu.zju.daily.metricguard.anomaly.baseline.Baseline;
import cn.edu.zju.daily.metricguard.anomaly.baseline.MeanBaseline;
import java.util.List;

/** Flags a value further than {@code maxAbsoluteChange} from the baseline. */
public class AbsoluteChangeDetector extends AbstractDetector {

    public static final String NAME = "absolute_change";

    private final double maxAbsoluteChange;
    private final Baseline baseline;

    public AbsoluteChangeDetector(double maxAbsoluteChange) {
        this(maxAbsoluteChange, new MeanBaseline(), 1);
    }

    public AbsoluteChangeDetector(
            double maxAbsoluteChange, Baseline baseline, int minHistorySize) {
        super(NAME, minHistorySize);
        if (!(maxAbsoluteChange > 0)) {
            throw new IllegalArgumentException("maxAbsoluteChange must be positive");
        }
        this.maxAbsoluteChange = maxAbsoluteChange;
        this.baseline = baseline;
    }

    @Override
    protected DetectionResult evaluate(String metricName, List<Double> history, double current) {
        double expected = baseline.compute(history);
        double change = Math.abs(current - expected);
        if (change <= maxAbsoluteChange) {
            return DetectionResult.normal();
        }
        double ratio = change / maxAbsoluteChange;
        return DetectionResult.anomaly(
                new Anomaly(
                        metricName,
                        NAME,
                        current,
                        expected,
                        expected - maxAbsoluteChange,
                        expected + maxAbsoluteChange,
                        Severity.fromRatio(ratio),
                        confidenceOf(ratio),
                        String.format(
                                "Absolute change of %.4f from %s %.4f exceeds %.4f",
                                change,
                                baseline.describe(),
                                expected,
                                maxAbsoluteChange)));
    }
}
