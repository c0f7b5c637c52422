package cn.edu.zju.daily.metricguard.incremental;

import cn.edu.zju.daily.metricguard.core.error.StoreException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Book-keeping stored next to the cumulative states of a series: the processed partitions, in
 * processing order, and for every metric the partitions that went into its state. It is saved in
 * the same entry as the states, so the processed marker only advances with a successful save.
 */
final class SeriesMetadata {

    static final String KEY = "__metadata__";

    private final Set<String> processed = new LinkedHashSet<>();
    private final Map<String, Set<String>> coverage = new TreeMap<>();

    boolean isProcessed(String partition) {
        return processed.contains(partition);
    }

    List<String> processed() {
        return new ArrayList<>(processed);
    }

    void record(String partition, List<String> metrics) {
        processed.add(partition);
        for (String metric : metrics) {
            coverage.computeIfAbsent(metric, k -> new LinkedHashSet<>()).add(partition);
        }
    }

    /** True if some processed partition did not contribute to {@code metric}. */
    boolean isPartial(String metric) {
        Set<String> covered = coverage.get(metric);
        return covered == null || covered.size() < processed.size();
    }

    List<String> partialMetrics() {
        List<String> partial = new ArrayList<>();
        for (String metric : coverage.keySet()) {
            if (isPartial(metric)) {
                partial.add(metric);
            }
        }
        return partial;
    }

    byte[] encode() {
        JSONObject json = new JSONObject();
        json.put("processed", new JSONArray(processed));
        JSONObject cov = new JSONObject();
        coverage.forEach((metric, partitions) -> cov.put(metric, new JSONArray(partitions)));
        json.put("coverage", cov);
        return json.toString().getBytes(StandardCharsets.UTF_8);
    }

    static SeriesMetadata decode(byte[] bytes) {
        SeriesMetadata metadata = new SeriesMetadata();
        if (bytes == null) {
            return metadata;
        }
        try {
            JSONObject json = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            JSONArray processed = json.getJSONArray("processed");
            for (int i = 0; i < processed.length(); i++) {
                metadata.processed.add(processed.getString(i));
            }
            JSONObject cov = json.getJSONObject("coverage");
            for (String metric : cov.keySet()) {
                JSONArray partitions = cov.getJSONArray(metric);
                Set<String> covered = new LinkedHashSet<>();
                for (int i = 0; i < partitions.length(); i++) {
                    covered.add(partitions.getString(i));
                }
                metadata.coverage.put(metric, covered);
            }
        } catch (JSONException e) {
            throw new StoreException("Corrupt series metadata", e);
        }
        return metadata;
    }
}
