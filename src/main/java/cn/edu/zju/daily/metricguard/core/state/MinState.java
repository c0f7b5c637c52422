package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public final class MinState implements AnalyzerState<MinState> {

    public static final MinState EMPTY = new MinState(Double.POSITIVE_INFINITY, 0);

    private final double min;
    private final long count;

    public MinState(double min, long count) {
        this.min = min;
        this.count = count;
    }

    @Override
    public MinState merge(MinState other) {
        States.checkSameShape(this, other);
        return new MinState(Math.min(min, other.min), count + other.count);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(count == 0 ? Double.NaN : min);
    }
}
