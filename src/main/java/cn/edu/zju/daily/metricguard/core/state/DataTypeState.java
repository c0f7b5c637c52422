package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Counts of values per detected type name. The metric is the share of each type among the
 * non-null values.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataTypeState implements AnalyzerState<DataTypeState> {

    public static final DataTypeState EMPTY = new DataTypeState(Collections.emptyMap());

    private final Map<String, Long> counts;

    public DataTypeState(Map<String, Long> counts) {
        this.counts = Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    @Override
    public DataTypeState merge(DataTypeState other) {
        States.checkSameShape(this, other);
        Map<String, Long> merged = new TreeMap<>(counts);
        other.counts.forEach((k, v) -> merged.merge(k, v, Long::sum));
        return new DataTypeState(merged);
    }

    @Override
    public MetricValue toMetric() {
        long total = total();
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            ratios.put(e.getKey(), total == 0 ? 0d : (double) e.getValue() / total);
        }
        return MetricValue.distribution(ratios);
    }
}
