package cn.edu.zju.daily.metricguard.anomaly.detector;

import cn.edu.zju.daily.metricguard.anomaly.Anomaly;
import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import java.util.List;
import java.util.Optional;

/** Delegates the decision to a user function of the history and the current value. */
public class CustomDetector extends AbstractDetector {

    @FunctionalInterface
    public interface Check {
        Optional<Anomaly> apply(String metricName, List<Double> history, double current);
    }

    private final Check check;

    public CustomDetector(String name, Check check) {
        this(name, 0, check);
    }

    public CustomDetector(String name, int minHistorySize, Check check) {
        super(name, minHistorySize);
        this.check = check;
    }

    @Override
    protected DetectionResult evaluate(String metricName, List<Double> history, double current) {
        return check.apply(metricName, history, current)
                .map(DetectionResult::anomaly)
                .orElse(DetectionResult.normal());
    }
}
