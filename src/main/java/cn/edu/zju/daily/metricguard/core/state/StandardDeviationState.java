package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Count, mean and sum of squared deviations (Welford). Partial states are combined with the
 * parallel form of the update, which keeps the variance stable for large partitions.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StandardDeviationState implements AnalyzerState<StandardDeviationState> {

    public static final StandardDeviationState EMPTY = new StandardDeviationState(0, 0d, 0d);

    private final long count;
    private final double mean;
    private final double m2;

    public StandardDeviationState(long count, double mean, double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public static StandardDeviationState of(double... values) {
        Accumulator acc = new Accumulator();
        for (double v : values) {
            acc.add(v);
        }
        return acc.toState();
    }

    /** Population variance, NaN when empty. */
    public double variance() {
        return count == 0 ? Double.NaN : m2 / count;
    }

    public double sampleVariance() {
        return count < 2 ? Double.NaN : m2 / (count - 1);
    }

    public double stddev() {
        return Math.sqrt(variance());
    }

    @Override
    public StandardDeviationState merge(StandardDeviationState other) {
        States.checkSameShape(this, other);
        if (other.count == 0) {
            return this;
        }
        if (count == 0) {
            return other;
        }
        long n = count + other.count;
        double delta = other.mean - mean;
        double newMean = mean + delta * other.count / n;
        double newM2 = m2 + other.m2 + delta * delta * count * other.count / n;
        return new StandardDeviationState(n, newMean, newM2);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(stddev());
    }

    /** Mutable single-pass accumulator for scans; one value at a time. */
    public static final class Accumulator {
        private long n = 0;
        private double mean = 0;
        private double m2 = 0;

        public void add(double v) {
            n++;
            double delta = v - mean;
            mean += delta / n;
            m2 += delta * (v - mean);
        }

        public long count() {
            return n;
        }

        public StandardDeviationState toState() {
            return new StandardDeviationState(n, mean, m2);
        }
    }
}
