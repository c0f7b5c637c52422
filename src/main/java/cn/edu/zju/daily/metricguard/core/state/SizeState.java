package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Number of rows. */
@Getter
@ToString
@EqualsAndHashCode
public final class SizeState implements AnalyzerState<SizeState> {

    public static final SizeState EMPTY = new SizeState(0);

    private final long count;

    public SizeState(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative count " + count);
        }
        this.count = count;
    }

    @Override
    public SizeState merge(SizeState other) {
        States.checkSameShape(this, other);
        return new SizeState(count + other.count);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(count);
    }
}
