package cn.edu.zju.daily.metricguard.sketch;

import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import cn.edu.zju.daily.metricguard.core.state.States;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.util.Arrays;
import java.util.Random;
import lombok.Getter;

/**
 * Immutable snapshot of a {@link KllSketch}. Level {@code h} holds sorted items of weight {@code
 * 2^h}.
 *
 * <p>Merging is commutative and has the empty state as identity. It is associative only up to the
 * sketch's rank error, since compactions happen at different points depending on the order.
 */
@Getter
public final class KllSketchState implements AnalyzerState<KllSketchState> {

    private final int k;
    private final long seed;
    private final long n;
    private final double min;
    private final double max;
    private final double[][] levels;

    public KllSketchState(int k, long seed, long n, double min, double max, double[][] levels) {
        this.k = k;
        this.seed = seed;
        this.n = n;
        this.min = min;
        this.max = max;
        this.levels = new double[levels.length][];
        for (int h = 0; h < levels.length; h++) {
            this.levels[h] = levels[h].clone();
        }
    }

    public static KllSketchState empty(int k, long seed) {
        return new KllSketchState(
                k, seed, 0, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, new double[1][0]);
    }

    /** A deep copy of the levels. */
    public double[][] getLevels() {
        double[][] copy = new double[levels.length][];
        for (int h = 0; h < levels.length; h++) {
            copy[h] = levels[h].clone();
        }
        return copy;
    }

    public boolean isEmpty() {
        return n == 0;
    }

    /**
     * Rank error of a single quantile query that holds with about 99% confidence, using the
     * empirical fit {@code 2.296 / k^0.9723} for compactors shrinking by 2/3.
     */
    public static double normalizedRankError(int k) {
        return 2.296 / Math.pow(k, 0.9723);
    }

    public double normalizedRankError() {
        return normalizedRankError(k);
    }

    public int retained() {
        int total = 0;
        for (double[] level : levels) {
            total += level.length;
        }
        return total;
    }

    /**
     * Approximate value at normalized rank {@code phi}; {@code 0} gives the minimum and {@code 1}
     * the maximum. NaN when the sketch is empty.
     */
    public double quantile(double phi) {
        if (phi < 0 || phi > 1 || Double.isNaN(phi)) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got " + phi);
        }
        if (n == 0) {
            return Double.NaN;
        }
        if (phi == 0) {
            return min;
        }
        if (phi == 1) {
            return max;
        }
        int total = retained();
        double[] values = new double[total];
        long[] weights = new long[total];
        Integer[] order = new Integer[total];
        int i = 0;
        long totalWeight = 0;
        for (int h = 0; h < levels.length; h++) {
            long weight = 1L << h;
            for (double v : levels[h]) {
                values[i] = v;
                weights[i] = weight;
                order[i] = i;
                totalWeight += weight;
                i++;
            }
        }
        Arrays.sort(order, (a, b) -> Double.compare(values[a], values[b]));
        long target = (long) Math.ceil(phi * totalWeight);
        long cumulative = 0;
        for (Integer idx : order) {
            cumulative += weights[idx];
            if (cumulative >= target) {
                return values[idx];
            }
        }
        return max;
    }

    public double[] quantiles(double... phis) {
        double[] result = new double[phis.length];
        for (int i = 0; i < phis.length; i++) {
            result[i] = quantile(phis[i]);
        }
        return result;
    }

    /** Approximate fraction of values less than or equal to {@code value}. */
    public double rank(double value) {
        if (n == 0) {
            return Double.NaN;
        }
        long below = 0;
        long totalWeight = 0;
        for (int h = 0; h < levels.length; h++) {
            long weight = 1L << h;
            for (double v : levels[h]) {
                totalWeight += weight;
                if (v <= value) {
                    below += weight;
                }
            }
        }
        return (double) below / totalWeight;
    }

    @Override
    public KllSketchState merge(KllSketchState other) {
        States.checkSameShape(this, other);
        if (k != other.k) {
            throw new StateIncompatibilityException(
                    "KLL sketch with k=" + k + " vs k=" + other.k);
        }
        if (other.n == 0) {
            return this;
        }
        if (n == 0) {
            return other;
        }
        long mergedSeed = HashUtils.symmetricSeed(seed, other.seed);
        KllSketch sketch = KllSketch.fromState(this, new Random(mergedSeed));
        sketch.merge(other);
        KllSketchState merged = sketch.snapshot();
        return new KllSketchState(k, mergedSeed, merged.n, merged.min, merged.max, merged.levels);
    }

    /** The median. */
    @Override
    public MetricValue toMetric() {
        return MetricValue.of(quantile(0.5));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KllSketchState)) {
            return false;
        }
        KllSketchState that = (KllSketchState) o;
        return k == that.k
                && seed == that.seed
                && n == that.n
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Arrays.deepEquals(levels, that.levels);
    }

    @Override
    public int hashCode() {
        int result = 31 * k + Long.hashCode(seed);
        result = 31 * result + Long.hashCode(n);
        return 31 * result + Arrays.deepHashCode(levels);
    }

    @Override
    public String toString() {
        return "KllSketchState{k=" + k + ", n=" + n + ", retained=" + retained() + "}";
    }
}
