package cn.edu.zju.daily.metricguard.anomaly;

import cn.edu.zju.daily.metricguard.config.Parameters;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps at most {@code capacity} points per metric, dropping the oldest. */
public class InMemoryMetricsRepository implements MetricsRepository {

    public static final int DEFAULT_CAPACITY = 1000;

    private static final Comparator<MetricPoint> BY_TIME =
            Comparator.comparing(MetricPoint::getTimestamp);

    private final int capacity;
    private final Map<String, List<MetricPoint>> series = new ConcurrentHashMap<>();

    public InMemoryMetricsRepository() {
        this(DEFAULT_CAPACITY);
    }

    public static InMemoryMetricsRepository fromParameters(Parameters params) {
        return new InMemoryMetricsRepository(params.getRepositoryCapacity());
    }

    public InMemoryMetricsRepository(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public void store(
            String metricName, double value, Instant timestamp, Map<String, String> tags) {
        List<MetricPoint> points = series.computeIfAbsent(metricName, k -> new ArrayList<>());
        synchronized (points) {
            MetricPoint point = new MetricPoint(timestamp, value, tags);
            int pos = points.size();
            while (pos > 0 && points.get(pos - 1).getTimestamp().isAfter(timestamp)) {
                pos--;
            }
            points.add(pos, point);
            while (points.size() > capacity) {
                points.remove(0);
            }
        }
    }

    @Override
    public List<MetricPoint> getHistory(String metricName, Instant from, Instant to) {
        List<MetricPoint> points = series.get(metricName);
        List<MetricPoint> history = new ArrayList<>();
        if (points == null) {
            return history;
        }
        synchronized (points) {
            for (MetricPoint p : points) {
                if (!p.getTimestamp().isBefore(from) && p.getTimestamp().isBefore(to)) {
                    history.add(p);
                }
            }
        }
        history.sort(BY_TIME);
        return history;
    }

    public int size(String metricName) {
        List<MetricPoint> points = series.get(metricName);
        if (points == null) {
            return 0;
        }
        synchronized (points) {
            return points.size();
        }
    }
}
