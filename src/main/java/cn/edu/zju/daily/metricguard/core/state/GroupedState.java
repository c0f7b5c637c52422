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
 * One inner state per group, keyed by the group's values. Every group seen is kept, so merging
 * partitions stays exact; limits on the number of reported groups are applied when finalizing.
 *
 * @param <S> the per-group state
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GroupedState<S extends AnalyzerState<S>>
        implements AnalyzerState<GroupedState<S>> {

    private final Map<String, S> groups;

    public GroupedState(Map<String, S> groups) {
        this.groups = Collections.unmodifiableMap(new TreeMap<>(groups));
    }

    public static <S extends AnalyzerState<S>> GroupedState<S> empty() {
        return new GroupedState<>(Collections.<String, S>emptyMap());
    }

    public int groupCount() {
        return groups.size();
    }

    /** Merge of all groups, {@code empty} when there are none. */
    public S overall(S empty) {
        return States.mergeAll(groups.values(), empty);
    }

    @Override
    public GroupedState<S> merge(GroupedState<S> other) {
        States.checkSameShape(this, other);
        Map<String, S> merged = new TreeMap<>(groups);
        for (Map.Entry<String, S> e : other.groups.entrySet()) {
            S mine = merged.get(e.getKey());
            merged.put(e.getKey(), mine == null ? e.getValue() : mine.merge(e.getValue()));
        }
        return new GroupedState<>(merged);
    }

    /** Per-group numeric metric; groups whose metric is not numeric map to NaN. */
    @Override
    public MetricValue toMetric() {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, S> e : groups.entrySet()) {
            values.put(e.getKey(), e.getValue().toMetric().asDouble().orElse(Double.NaN));
        }
        return MetricValue.distribution(values);
    }
}
