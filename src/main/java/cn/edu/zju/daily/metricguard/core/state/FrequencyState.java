package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Exact value frequencies of one or more columns plus the number of rows seen. Grouping keys are
 * the string forms of the values, and a null value is counted under {@link #NULL_KEY}.
 *
 * <p>Memory grows with the number of distinct values.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FrequencyState implements AnalyzerState<FrequencyState> {

    public static final String NULL_KEY = "NullValue";

    public static final FrequencyState EMPTY = new FrequencyState(Collections.emptyMap(), 0);

    private final Map<String, Long> frequencies;
    private final long numRows;

    public FrequencyState(Map<String, Long> frequencies, long numRows) {
        this.frequencies = Collections.unmodifiableMap(new TreeMap<>(frequencies));
        this.numRows = numRows;
    }

    public long distinctCount() {
        return frequencies.size();
    }

    public long uniqueCount() {
        return frequencies.values().stream().filter(c -> c == 1L).count();
    }

    /** Number of non-null rows that went into the frequencies. */
    public long groupedRows() {
        return frequencies.values().stream().mapToLong(Long::longValue).sum();
    }

    /** Shannon entropy in nats over the grouped rows. */
    public double entropy() {
        long total = groupedRows();
        if (total == 0) {
            return 0d;
        }
        double entropy = 0;
        for (long c : frequencies.values()) {
            double p = (double) c / total;
            entropy -= p * Math.log(p);
        }
        return entropy;
    }

    /** Most frequent values first; ties are broken by value so the order is stable. */
    public List<Pair<String, Long>> top(int n) {
        List<Pair<String, Long>> entries = new ArrayList<>();
        for (Map.Entry<String, Long> e : frequencies.entrySet()) {
            entries.add(Pair.of(e.getKey(), e.getValue()));
        }
        entries.sort(
                Comparator.comparing((Pair<String, Long> p) -> p.getRight())
                        .reversed()
                        .thenComparing(Pair::getLeft));
        return entries.size() <= n ? entries : new ArrayList<>(entries.subList(0, n));
    }

    @Override
    public FrequencyState merge(FrequencyState other) {
        States.checkSameShape(this, other);
        Map<String, Long> merged = new TreeMap<>(frequencies);
        other.frequencies.forEach((k, v) -> merged.merge(k, v, Long::sum));
        return new FrequencyState(merged, numRows + other.numRows);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(distinctCount());
    }
}
