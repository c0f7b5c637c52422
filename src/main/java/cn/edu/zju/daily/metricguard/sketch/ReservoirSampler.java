package cn.edu.zju.daily.metricguard.sketch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Uniform fixed-size sample of a stream (Knuth's algorithm S). After {@code i} items every item
 * has been retained with probability {@code capacity / i}.
 */
public final class ReservoirSampler<T> {

    public static final int DEFAULT_CAPACITY = 1000;

    private final List<T> samples;
    private final int capacity;
    private final Random random;

    private long itemsSeen = 0;

    public ReservoirSampler(Random random) {
        this(DEFAULT_CAPACITY, random);
    }

    public ReservoirSampler(int capacity, Random random) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.samples = new ArrayList<>(Math.min(capacity, 1 << 16));
        this.capacity = capacity;
        this.random = random;
    }

    public void update(T item) {
        itemsSeen++;
        if (itemsSeen <= capacity) {
            samples.add(item);
        } else if ((long) (random.nextDouble() * itemsSeen) < capacity) {
            samples.set(random.nextInt(capacity), item);
        }
    }

    public List<T> samples() {
        return Collections.unmodifiableList(samples);
    }

    public long getItemsSeen() {
        return itemsSeen;
    }

    public int getCapacity() {
        return capacity;
    }
}
