package cn.edu.zju.daily.metricguard.profiler;

import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.tuple.Pair;

/**
 * The most frequent values of a column, at most {@code topN} buckets. {@code complete} is false
 * when less frequent values had to be dropped.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CategoricalHistogram {

    private final List<CategoricalBucket> buckets;
    private final long totalCount;
    private final long distinctValues;
    private final boolean complete;

    /** Entropy in bits over all values, not just the kept buckets. */
    private final double entropy;

    public CategoricalHistogram(
            List<CategoricalBucket> buckets,
            long totalCount,
            long distinctValues,
            boolean complete,
            double entropy) {
        this.buckets = Collections.unmodifiableList(new ArrayList<>(buckets));
        this.totalCount = totalCount;
        this.distinctValues = distinctValues;
        this.complete = complete;
        this.entropy = entropy;
    }

    public static CategoricalHistogram fromFrequencies(FrequencyState state, int topN) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be positive, got " + topN);
        }
        long total = state.groupedRows();
        List<CategoricalBucket> buckets = new ArrayList<>();
        for (Pair<String, Long> entry : state.top(topN)) {
            double percentage = total == 0 ? 0d : (double) entry.getRight() / total;
            buckets.add(new CategoricalBucket(entry.getLeft(), entry.getRight(), percentage));
        }
        long distinct = state.distinctCount();
        return new CategoricalHistogram(
                buckets, total, distinct, distinct <= topN, state.entropy() / Math.log(2));
    }
}
