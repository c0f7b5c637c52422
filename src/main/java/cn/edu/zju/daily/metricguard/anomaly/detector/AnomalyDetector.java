package cn.edu.zju.daily.metricguard.anomaly.detector;

import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import cn.edu.zju.daily.metricguard.anomaly.MetricPoint;
import java.util.List;

public interface AnomalyDetector {

    String name();

    /**
     * Judges {@code current} against the metric's history.
     *
     * @param history points oldest first, not including {@code current}
     */
    DetectionResult detect(String metricName, List<MetricPoint> history, double current);
}
