package cn.edu.zju.daily.metricguard.analyzer.grouped;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Reported per-group metrics of one grouped analyzer run. */
@Getter
@ToString
@EqualsAndHashCode
public final class GroupedMetrics {

    public static final String OVERALL_KEY = "__overall__";

    private final List<String> groupColumns;
    private final Map<String, MetricValue> groups;
    /** Metric over all rows, or null when not requested. */
    private final MetricValue overall;
    private final int totalGroups;

    public GroupedMetrics(
            List<String> groupColumns,
            Map<String, MetricValue> groups,
            MetricValue overall,
            int totalGroups) {
        this.groupColumns = groupColumns;
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        this.overall = overall;
        this.totalGroups = totalGroups;
    }

    public int groupCount() {
        return groups.size();
    }

    public Optional<MetricValue> getGroup(String key) {
        return Optional.ofNullable(groups.get(key));
    }

    public boolean isTruncated() {
        return totalGroups > groups.size();
    }

    /** Numeric group metrics plus {@link #OVERALL_KEY}; non-numeric metrics map to NaN. */
    public MetricValue toMetricValue() {
        Map<String, Double> values = new LinkedHashMap<>();
        groups.forEach((k, v) -> values.put(k, v.asDouble().orElse(Double.NaN)));
        if (overall != null) {
            values.put(OVERALL_KEY, overall.asDouble().orElse(Double.NaN));
        }
        return MetricValue.distribution(values);
    }
}
