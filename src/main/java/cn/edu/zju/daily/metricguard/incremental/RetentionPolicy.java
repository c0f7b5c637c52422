package cn.edu.zju.daily.metricguard.incremental;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.ToString;

/**
 * Chooses which recorded partition deltas to delete. Partition keys are ordered lexicographically,
 * so keys such as {@code 2024-01-31} sort by time.
 */
@ToString
public final class RetentionPolicy {

    private final int keepLatest;
    private final String olderThan;

    private RetentionPolicy(int keepLatest, String olderThan) {
        this.keepLatest = keepLatest;
        this.olderThan = olderThan;
    }

    /** Keeps the {@code n} greatest partition keys. */
    public static RetentionPolicy keepLatest(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot keep a negative number of partitions");
        }
        return new RetentionPolicy(n, null);
    }

    /** Deletes every partition whose key sorts before {@code key}. */
    public static RetentionPolicy olderThan(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        return new RetentionPolicy(-1, key);
    }

    List<String> select(List<String> partitionKeys) {
        List<String> sorted = new ArrayList<>(partitionKeys);
        Collections.sort(sorted);
        if (olderThan != null) {
            List<String> expired = new ArrayList<>();
            for (String key : sorted) {
                if (key.compareTo(olderThan) < 0) {
                    expired.add(key);
                }
            }
            return expired;
        }
        int expired = Math.max(0, sorted.size() - keepLatest);
        return new ArrayList<>(sorted.subList(0, expired));
    }
}
