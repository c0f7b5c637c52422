package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Co-moments of two numeric columns, enough to finalize the Pearson correlation. */
@Getter
@ToString
@EqualsAndHashCode
public final class CorrelationState implements AnalyzerState<CorrelationState> {

    public static final CorrelationState EMPTY = new CorrelationState(0, 0, 0, 0, 0, 0);

    private final long count;
    private final double xMean;
    private final double yMean;
    private final double coMoment;
    private final double xM2;
    private final double yM2;

    public CorrelationState(
            long count, double xMean, double yMean, double coMoment, double xM2, double yM2) {
        this.count = count;
        this.xMean = xMean;
        this.yMean = yMean;
        this.coMoment = coMoment;
        this.xM2 = xM2;
        this.yM2 = yM2;
    }

    public static CorrelationState of(double[] xs, double[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Columns have different lengths");
        }
        CorrelationState state = EMPTY;
        for (int i = 0; i < xs.length; i++) {
            state = state.merge(new CorrelationState(1, xs[i], ys[i], 0, 0, 0));
        }
        return state;
    }

    public double correlation() {
        if (count == 0 || xM2 == 0 || yM2 == 0) {
            return Double.NaN;
        }
        return coMoment / Math.sqrt(xM2 * yM2);
    }

    @Override
    public CorrelationState merge(CorrelationState other) {
        States.checkSameShape(this, other);
        if (other.count == 0) {
            return this;
        }
        if (count == 0) {
            return other;
        }
        long n = count + other.count;
        double dx = other.xMean - xMean;
        double dy = other.yMean - yMean;
        double weight = (double) count * other.count / n;
        return new CorrelationState(
                n,
                xMean + dx * other.count / n,
                yMean + dy * other.count / n,
                coMoment + other.coMoment + dx * dy * weight,
                xM2 + other.xM2 + dx * dx * weight,
                yM2 + other.yM2 + dy * dy * weight);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(correlation());
    }
}
