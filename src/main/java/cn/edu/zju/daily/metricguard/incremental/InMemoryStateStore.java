package cn.edu.zju.daily.metricguard.incremental;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryStateStore implements StateStore {

    private final Map<String, Map<String, byte[]>> entries = new ConcurrentHashMap<>();

    @Override
    public void saveState(String key, Map<String, byte[]> states) {
        entries.put(key, copy(states));
    }

    @Override
    public Optional<Map<String, byte[]>> loadState(String key) {
        Map<String, byte[]> states = entries.get(key);
        return states == null ? Optional.empty() : Optional.of(copy(states));
    }

    @Override
    public List<String> listPartitions() {
        List<String> keys = new ArrayList<>(entries.keySet());
        Collections.sort(keys);
        return keys;
    }

    @Override
    public void deleteState(String key) {
        entries.remove(key);
    }

    private static Map<String, byte[]> copy(Map<String, byte[]> states) {
        Map<String, byte[]> copy = new LinkedHashMap<>();
        states.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }
}
