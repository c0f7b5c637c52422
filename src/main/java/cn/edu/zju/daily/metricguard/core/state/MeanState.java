package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Running sum and count; the mean of an empty state is NaN. */
@Getter
@ToString
@EqualsAndHashCode
public final class MeanState implements AnalyzerState<MeanState> {

    public static final MeanState EMPTY = new MeanState(0d, 0);

    private final double sum;
    private final long count;

    public MeanState(double sum, long count) {
        this.sum = sum;
        this.count = count;
    }

    public static MeanState of(double... values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return new MeanState(sum, values.length);
    }

    public double mean() {
        return count == 0 ? Double.NaN : sum / count;
    }

    @Override
    public MeanState merge(MeanState other) {
        States.checkSameShape(this, other);
        return new MeanState(sum + other.sum, count + other.count);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(mean());
    }
}
