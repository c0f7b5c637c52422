package cn.edu.zju.daily.metricguard.anomaly.detector;

import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import cn.edu.zju.daily.metricguard.anomaly.MetricPoint;
import cn.edu.zju.daily.metricguard.core.error.InsufficientHistoryException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the minimum history size and turns {@link InsufficientHistoryException} into an
 * abstention.
 */
public abstract class AbstractDetector implements AnomalyDetector {

    private final String name;
    private final int minHistorySize;

    protected AbstractDetector(String name, int minHistorySize) {
        if (minHistorySize < 0) {
            throw new IllegalArgumentException("minHistorySize must not be negative");
        }
        this.name = name;
        this.minHistorySize = minHistorySize;
    }

    @Override
    public String name() {
        return name;
    }

    public int getMinHistorySize() {
        return minHistorySize;
    }

    @Override
    public final DetectionResult detect(
            String metricName, List<MetricPoint> history, double current) {
        try {
            if (history.size() < minHistorySize) {
                throw new InsufficientHistoryException(history.size(), minHistorySize);
            }
            return evaluate(metricName, values(history), current);
        } catch (InsufficientHistoryException e) {
            return DetectionResult.insufficientData(e.getMessage());
        }
    }

    protected abstract DetectionResult evaluate(
            String metricName, List<Double> history, double current);

    /** Confidence of a finding {@code ratio} times past its threshold. */
    protected static double confidenceOf(double ratio) {
        return Math.min(1d, ratio / 2);
    }

    private static List<Double> values(List<MetricPoint> history) {
        List<Double> values = new ArrayList<>(history.size());
        for (MetricPoint p : history) {
            values.add(p.getValue());
        }
        return values;
    }
}
