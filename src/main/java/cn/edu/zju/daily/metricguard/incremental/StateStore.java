package cn.edu.zju.daily.metricguard.incremental;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists serialized analyzer states, keyed by partition or series. Each entry maps metric keys
 * to encoded states. Implementations report failures with {@link
 * cn.edu.zju.daily.metricguard.core.error.StoreException}.
 */
public interface StateStore {

    /** Replaces the entry for {@code key}. */
    void saveState(String key, Map<String, byte[]> states);

    Optional<Map<String, byte[]>> loadState(String key);

    /** All keys with an entry, sorted. */
    List<String> listPartitions();

    /** Deletes the entry for {@code key}; deleting a missing key does nothing. */
    void deleteState(String key);
}
