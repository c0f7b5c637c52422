package cn.edu.zju.daily.metricguard.sketch;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.junit.jupiter.api.Test;

class KllSketchTest {

    private static final double[] QUANTILES = {0.01, 0.05, 0.1, 0.25, 0.5, 0.75, 0.9, 0.95, 0.99};

    private static List<Double> shuffledRange(int n, long seed) {
        List<Double> values = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            values.add((double) i);
        }
        Collections.shuffle(values, new Random(seed));
        return values;
    }

    /** Largest distance between requested and actual rank over {@link #QUANTILES}. */
    private static double maxRankError(int k, int n, long seed) {
        KllSketch sketch = new KllSketch(k, seed);
        for (double v : shuffledRange(n, seed)) {
            sketch.update(v);
        }
        KllSketchState state = sketch.snapshot();
        double worst = 0;
        for (double q : QUANTILES) {
            // values are 0..n-1, so the true rank of v is (v + 1) / n
            double rank = (state.quantile(q) + 1) / n;
            worst = Math.max(worst, Math.abs(rank - q));
        }
        return worst;
    }

    @Test
    void testRankError() {
        int n = 100_000;
        double bound = KllSketchState.normalizedRankError(200);
        assertEquals(0.0133, bound, 1e-4);
        for (long seed = 0; seed < 5; seed++) {
            double error = maxRankError(200, n, seed);
            assertTrue(error <= bound, "error " + error + " with seed " + seed);
        }
    }

    @Test
    void testErrorShrinksWithK() {
        int n = 200_000;
        int seeds = 5;
        double[] meanError = new double[3];
        int[] ks = {50, 200, 800};
        for (int i = 0; i < ks.length; i++) {
            for (long seed = 0; seed < seeds; seed++) {
                meanError[i] += maxRankError(ks[i], n, seed) / seeds;
            }
            System.out.printf("k=%d: mean max rank error %.4f%n", ks[i], meanError[i]);
            assertTrue(meanError[i] <= KllSketchState.normalizedRankError(ks[i]));
        }
        // four times the size at least halves the error
        assertTrue(meanError[1] <= meanError[0] / 2, Arrays.toString(meanError));
        assertTrue(meanError[2] <= meanError[1] / 2, Arrays.toString(meanError));
    }

    @Test
    void testNormalDistribution() {
        double[] data = new NormalDistribution(new Well19937c(17), 100, 15).sample(50_000);
        KllSketch sketch = new KllSketch(200, 17L);
        for (double v : data) {
            sketch.update(v);
        }
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        Percentile percentile = new Percentile();
        for (double q : new double[] {0.1, 0.5, 0.9}) {
            double estimate = sketch.quantile(q);
            int pos = Arrays.binarySearch(sorted, estimate);
            assertTrue(pos >= 0, "estimate must be an input value");
            assertEquals(q, (pos + 1d) / sorted.length, 0.03, "quantile " + q);
            assertEquals(percentile.evaluate(data, q * 100), estimate, 2.0);
        }
    }

    @Test
    void testExtremes() {
        KllSketch sketch = new KllSketch(50, 7L);
        for (double v : shuffledRange(10_000, 7L)) {
            sketch.update(v);
        }
        sketch.update(Double.NaN);
        KllSketchState state = sketch.snapshot();
        assertEquals(0d, state.quantile(0));
        assertEquals(9_999d, state.quantile(1));
        assertEquals(10_000, state.getN());
        assertThrows(IllegalArgumentException.class, () -> state.quantile(1.5));
    }

    @Test
    void testSmallInputIsExact() {
        KllSketch sketch = new KllSketch(200, 1L);
        for (int i = 1; i <= 100; i++) {
            sketch.update(i);
        }
        assertEquals(50d, sketch.quantile(0.5));
        assertEquals(1d, sketch.snapshot().rank(100), 1e-12);
    }

    @Test
    void testMemoryBounded() {
        int k = 100;
        KllSketch sketch = new KllSketch(k, 3L);
        for (double v : shuffledRange(200_000, 3L)) {
            sketch.update(v);
        }
        assertTrue(sketch.retained() < 4 * k, "retained " + sketch.retained());
        assertTrue(sketch.numLevels() > 1);
    }

    @Test
    void testMerge() {
        KllSketch left = new KllSketch(200, 11L);
        KllSketch right = new KllSketch(200, 12L);
        List<Double> values = shuffledRange(50_000, 5L);
        for (int i = 0; i < values.size(); i++) {
            (i % 2 == 0 ? left : right).update(values.get(i));
        }
        KllSketchState a = left.snapshot();
        KllSketchState b = right.snapshot();
        KllSketchState merged = a.merge(b);

        assertEquals(merged, b.merge(a));
        assertEquals(50_000, merged.getN());
        assertEquals(0d, merged.getMin());
        assertEquals(49_999d, merged.getMax());
        assertEquals(0.5, (merged.quantile(0.5) + 1) / 50_000, 0.05);

        KllSketchState empty = KllSketchState.empty(200, 0L);
        assertEquals(a, a.merge(empty));
        assertEquals(a, empty.merge(a));
    }

    @Test
    void testEmpty() {
        KllSketchState empty = KllSketchState.empty(200, 0L);
        assertTrue(empty.isEmpty());
        assertTrue(Double.isNaN(empty.quantile(0.5)));
    }

    @Test
    void testDifferentKRejected() {
        KllSketch a = new KllSketch(100, 1L);
        KllSketch b = new KllSketch(200, 1L);
        a.update(1);
        b.update(2);
        assertThrows(
                StateIncompatibilityException.class, () -> a.snapshot().merge(b.snapshot()));
        assertThrows(IllegalArgumentException.class, () -> new KllSketch(4, 1L));
    }
}
