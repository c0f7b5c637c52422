package cn.edu.zju.daily.metricguard.anomaly;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One historical value of a metric. */
@Getter
@ToString
@EqualsAndHashCode
public final class MetricPoint {

    private final Instant timestamp;
    private final double value;
    private final Map<String, String> tags;

    public MetricPoint(Instant timestamp, double value) {
        this(timestamp, value, Collections.emptyMap());
    }

    public MetricPoint(Instant timestamp, double value, Map<String, String> tags) {
        this.timestamp = timestamp;
        this.value = value;
        this.tags = Collections.unmodifiableMap(new TreeMap<>(tags));
    }
}
