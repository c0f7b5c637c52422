package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public final class MaxState implements AnalyzerState<MaxState> {

    public static final MaxState EMPTY = new MaxState(Double.NEGATIVE_INFINITY, 0);

    private final double max;
    private final long count;

    public MaxState(double max, long count) {
        this.max = max;
        this.count = count;
    }

    @Override
    public MaxState merge(MaxState other) {
        States.checkSameShape(this, other);
        return new MaxState(Math.max(max, other.max), count + other.count);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(count == 0 ? Double.NaN : max);
    }
}
