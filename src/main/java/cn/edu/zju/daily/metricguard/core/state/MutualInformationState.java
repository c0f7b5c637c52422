package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Joint and marginal frequencies of two columns. Keys of the joint frequencies are built with
 * {@link #pairKey(String, String)}. States computed with a different number of bins cannot be
 * merged.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MutualInformationState implements AnalyzerState<MutualInformationState> {

    private static final String PAIR_SEPARATOR = ":";

    private final FrequencyState joint;
    private final FrequencyState first;
    private final FrequencyState second;
    private final int bins;

    public MutualInformationState(
            FrequencyState joint, FrequencyState first, FrequencyState second, int bins) {
        if (bins < 0) {
            throw new IllegalArgumentException("bins must not be negative");
        }
        this.joint = joint;
        this.first = first;
        this.second = second;
        this.bins = bins;
    }

    public static MutualInformationState empty(int bins) {
        return new MutualInformationState(
                FrequencyState.EMPTY, FrequencyState.EMPTY, FrequencyState.EMPTY, bins);
    }

    /** Length-prefixed so that any pair of values maps to a distinct key. */
    public static String pairKey(String x, String y) {
        return x.length() + PAIR_SEPARATOR + x + y;
    }

    /** Number of rows where both values were present. */
    public long count() {
        return joint.groupedRows();
    }

    /** Mutual information in bits; zero when no pairs were seen. */
    public double mutualInformation() {
        long n = count();
        if (n == 0) {
            return 0d;
        }
        Map<String, Long> xCounts = first.getFrequencies();
        Map<String, Long> yCounts = second.getFrequencies();
        double mi = 0;
        for (Map.Entry<String, Long> e : joint.getFrequencies().entrySet()) {
            String key = e.getKey();
            int sep = key.indexOf(PAIR_SEPARATOR);
            int length = Integer.parseInt(key.substring(0, sep));
            String x = key.substring(sep + 1, sep + 1 + length);
            String y = key.substring(sep + 1 + length);
            double pxy = (double) e.getValue() / n;
            double px = (double) xCounts.get(x) / n;
            double py = (double) yCounts.get(y) / n;
            mi += pxy * Math.log(pxy / (px * py));
        }
        return Math.max(0d, mi / Math.log(2));
    }

    @Override
    public MutualInformationState merge(MutualInformationState other) {
        States.checkSameShape(this, other);
        if (bins != other.bins) {
            throw new StateIncompatibilityException(
                    "Cannot merge mutual information with " + bins + " and " + other.bins
                            + " bins");
        }
        return new MutualInformationState(
                joint.merge(other.joint),
                first.merge(other.first),
                second.merge(other.second),
                bins);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(mutualInformation());
    }
}
