package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Matching rows over total rows, used by completeness and compliance. */
@Getter
@ToString
@EqualsAndHashCode
public final class RatioState implements AnalyzerState<RatioState> {

    public static final RatioState EMPTY = new RatioState(0, 0);

    private final long matches;
    private final long count;

    public RatioState(long matches, long count) {
        if (matches > count) {
            throw new IllegalArgumentException(
                    "Matches " + matches + " exceed total count " + count);
        }
        this.matches = matches;
        this.count = count;
    }

    public double ratio() {
        return count == 0 ? Double.NaN : (double) matches / count;
    }

    @Override
    public RatioState merge(RatioState other) {
        States.checkSameShape(this, other);
        return new RatioState(matches + other.matches, count + other.count);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(ratio());
    }
}
