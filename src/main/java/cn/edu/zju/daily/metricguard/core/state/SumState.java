package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Sum of the non-null values of a numeric column. */
@Getter
@ToString
@EqualsAndHashCode
public final class SumState implements AnalyzerState<SumState> {

    public static final SumState EMPTY = new SumState(0d, 0);

    private final double sum;
    private final long count;

    public SumState(double sum, long count) {
        this.sum = sum;
        this.count = count;
    }

    @Override
    public SumState merge(SumState other) {
        States.checkSameShape(this, other);
        return new SumState(sum + other.sum, count + other.count);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(sum);
    }
}
