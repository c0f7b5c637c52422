package cn.edu.zju.daily.metricguard.sketch;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import org.junit.jupiter.api.Test;

class HyperLogLogTest {

    private static final int DISTINCT = 100_000;

    @Test
    void testEstimateAcrossSeeds() {
        int trials = 100;
        int within = 0;
        double meanError = 0;
        for (int seed = 0; seed < trials; seed++) {
            HyperLogLog hll = new HyperLogLog(12, seed);
            for (int i = 0; i < DISTINCT; i++) {
                hll.add("key-" + i);
            }
            double error = Math.abs(hll.estimate() - DISTINCT) / (double) DISTINCT;
            if (error <= 0.03) {
                within++;
            }
            meanError += (hll.estimate() - DISTINCT) / (double) DISTINCT;
        }
        System.out.printf("%d of %d trials within 3%%%n", within, trials);
        assertTrue(within >= 95, "only " + within + " of " + trials + " trials within 3%");
        assertTrue(Math.abs(meanError / trials) <= 0.01);
    }

    @Test
    void testDuplicatesAndNullsNotCounted() {
        HyperLogLog hll = new HyperLogLog();
        for (int round = 0; round < 10; round++) {
            for (int i = 0; i < 1000; i++) {
                hll.add(i);
            }
            hll.add(null);
        }
        assertEquals(1000, hll.estimate(), 1000 * 0.05);
    }

    @Test
    void testEmpty() {
        assertEquals(0, new HyperLogLog().estimate());
        assertEquals(0, HyperLogLogState.empty(12, 0).estimate());
    }

    @Test
    void testIntegralValuesHashAlike() {
        HyperLogLog a = new HyperLogLog(10, 0);
        HyperLogLog b = new HyperLogLog(10, 0);
        for (int i = 0; i < 500; i++) {
            a.add(i);
            b.add((long) i);
        }
        assertEquals(a.snapshot(), b.snapshot());
    }

    @Test
    void testMergeEqualsUnion() {
        HyperLogLog left = new HyperLogLog(11, 3);
        HyperLogLog right = new HyperLogLog(11, 3);
        HyperLogLog all = new HyperLogLog(11, 3);
        for (int i = 0; i < 20_000; i++) {
            (i % 3 == 0 ? left : right).add("v" + i);
            all.add("v" + i);
        }
        // overlap
        for (int i = 0; i < 5_000; i++) {
            left.add("v" + i);
        }
        HyperLogLogState merged = left.snapshot().merge(right.snapshot());
        assertEquals(all.snapshot(), merged);
        assertEquals(merged, right.snapshot().merge(left.snapshot()));
        assertEquals(merged, merged.merge(HyperLogLogState.empty(11, 3)));
    }

    @Test
    void testMemoryIndependentOfInput() {
        HyperLogLog hll = new HyperLogLog(12, 0);
        for (int i = 0; i < 200_000; i++) {
            hll.add(i);
        }
        assertEquals(4096, hll.snapshot().getRegisters().length);
        assertEquals(1.04 / 64, hll.snapshot().relativeError(), 1e-12);
    }

    @Test
    void testIncompatibleConfigurationsRejected() {
        HyperLogLogState p12 = HyperLogLogState.empty(12, 0);
        assertThrows(
                StateIncompatibilityException.class,
                () -> p12.merge(HyperLogLogState.empty(10, 0)));
        assertThrows(
                StateIncompatibilityException.class,
                () -> p12.merge(HyperLogLogState.empty(12, 1)));
        assertThrows(IllegalArgumentException.class, () -> new HyperLogLog(3, 0));
        assertThrows(IllegalArgumentException.class, () -> new HyperLogLog(19, 0));
    }
}
