package cn.edu.zju.daily.metricguard.anomaly;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Time series of metric values, the input of anomaly detection. */
public interface MetricsRepository {

    void store(String metricName, double value, Instant timestamp, Map<String, String> tags);

    /** Points with {@code from <= timestamp < to}, oldest first. */
    List<MetricPoint> getHistory(String metricName, Instant from, Instant to);
}
