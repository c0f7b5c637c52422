package cn.edu.zju.daily.metricguard.sketch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Mutable KLL quantile sketch over doubles.
 *
 * <p>Values enter level 0. When the sketch holds more items than the sum of its level capacities,
 * the lowest full level is sorted and every other item (starting at a random parity) is promoted to
 * the next level, where it carries twice the weight. Capacities shrink geometrically by a factor of
 * 2/3 from the top level down, so memory stays around {@code 3k} items. The rank error bound for
 * a given {@code k} is {@link KllSketchState#normalizedRankError(int)}; it falls almost linearly
 * in {@code k}.
 *
 * <p>The random source is injected so that runs can be reproduced.
 */
public class KllSketch {

    public static final int DEFAULT_K = 200;
    public static final int MIN_K = 8;

    private static final double CAPACITY_DECAY = 2d / 3d;

    private final int k;
    private final Random random;
    private final long mergeSeed;
    private final List<Compactor> compactors = new ArrayList<>();
    private int size = 0;
    private int maxSize = 0;
    private long n = 0;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public KllSketch() {
        this(DEFAULT_K, new Random());
    }

    public KllSketch(int k, long seed) {
        this(k, new Random(seed));
    }

    public KllSketch(int k, Random random) {
        if (k < MIN_K) {
            throw new IllegalArgumentException("k must be at least " + MIN_K + ", got " + k);
        }
        this.k = k;
        this.random = random;
        this.mergeSeed = random.nextLong();
        grow();
    }

    public static KllSketch fromState(KllSketchState state, Random random) {
        KllSketch sketch = new KllSketch(state.getK(), random);
        sketch.load(state);
        return sketch;
    }

    private void load(KllSketchState state) {
        double[][] levels = state.getLevels();
        while (compactors.size() < levels.length) {
            grow();
        }
        for (int h = 0; h < levels.length; h++) {
            compactors.get(h).addAll(levels[h]);
        }
        n += state.getN();
        min = Math.min(min, state.getMin());
        max = Math.max(max, state.getMax());
        recount();
    }

    /** NaN values are ignored. */
    public void update(double value) {
        if (Double.isNaN(value)) {
            return;
        }
        n++;
        min = Math.min(min, value);
        max = Math.max(max, value);
        compactors.get(0).add(value);
        size++;
        if (size >= maxSize) {
            compress();
        }
    }

    public void merge(KllSketchState other) {
        if (other.getK() != k) {
            throw new IllegalArgumentException(
                    "Cannot merge KLL sketches with k=" + k + " and k=" + other.getK());
        }
        load(other);
        while (size >= maxSize) {
            compress();
        }
    }

    public long getN() {
        return n;
    }

    public int getK() {
        return k;
    }

    public boolean isEmpty() {
        return n == 0;
    }

    /** Number of retained items. */
    public int retained() {
        return size;
    }

    public int numLevels() {
        return compactors.size();
    }

    public double quantile(double phi) {
        return snapshot().quantile(phi);
    }

    public KllSketchState snapshot() {
        double[][] levels = new double[compactors.size()][];
        for (int h = 0; h < levels.length; h++) {
            levels[h] = compactors.get(h).sortedCopy();
        }
        return new KllSketchState(k, mergeSeed, n, min, max, levels);
    }

    private void grow() {
        compactors.add(new Compactor());
        int total = 0;
        for (int h = 0; h < compactors.size(); h++) {
            total += capacity(h);
        }
        maxSize = total;
    }

    private int capacity(int height) {
        int depth = compactors.size() - height - 1;
        return (int) Math.ceil(Math.pow(CAPACITY_DECAY, depth) * k) + 1;
    }

    private void compress() {
        for (int h = 0; h < compactors.size(); h++) {
            if (compactors.get(h).size >= capacity(h)) {
                if (h + 1 >= compactors.size()) {
                    grow();
                }
                double[] promoted = compactors.get(h).compact(random);
                compactors.get(h + 1).addAll(promoted);
                recount();
                return;
            }
        }
    }

    private void recount() {
        int total = 0;
        for (Compactor c : compactors) {
            total += c.size;
        }
        size = total;
    }

    private static class Compactor {
        private double[] items = new double[16];
        private int size = 0;

        void add(double value) {
            ensure(size + 1);
            items[size++] = value;
        }

        void addAll(double[] values) {
            ensure(size + values.length);
            System.arraycopy(values, 0, items, size, values.length);
            size += values.length;
        }

        double[] sortedCopy() {
            double[] copy = Arrays.copyOf(items, size);
            Arrays.sort(copy);
            return copy;
        }

        /** Keeps one leftover item when the level is odd and returns the promoted half. */
        double[] compact(Random random) {
            Arrays.sort(items, 0, size);
            int start = size % 2;
            int offset = random.nextBoolean() ? 1 : 0;
            double[] promoted = new double[(size - start) / 2];
            for (int i = start, j = 0; i < size; i += 2, j++) {
                promoted[j] = items[i + offset];
            }
            size = start;
            return promoted;
        }

        private void ensure(int capacity) {
            if (capacity > items.length) {
                items = Arrays.copyOf(items, Math.max(capacity, items.length * 2));
            }
        }
    }
}
