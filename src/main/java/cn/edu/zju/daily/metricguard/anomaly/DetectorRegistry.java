package cn.edu.zju.daily.metricguard.anomaly;

import cn.edu.zju.daily.metricguard.anomaly.detector.AnomalyDetector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Detectors keyed by metric name pattern. A pattern is an exact name or contains {@code *}, which
 * matches any run of characters; {@code *} alone matches every metric.
 */
public class DetectorRegistry {

    private final List<Pair<Pattern, AnomalyDetector>> detectors = new ArrayList<>();
    private final List<String> patterns = new ArrayList<>();

    public DetectorRegistry register(String pattern, AnomalyDetector detector) {
        detectors.add(Pair.of(compile(pattern), detector));
        patterns.add(pattern);
        return this;
    }

    /** Every detector whose pattern matches, in registration order. */
    public List<AnomalyDetector> detectorsFor(String metricName) {
        List<AnomalyDetector> matching = new ArrayList<>();
        for (Pair<Pattern, AnomalyDetector> entry : detectors) {
            if (entry.getLeft().matcher(metricName).matches()) {
                matching.add(entry.getRight());
            }
        }
        return matching;
    }

    public List<String> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public boolean isEmpty() {
        return detectors.isEmpty();
    }

    static Pattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern must not be empty");
        }
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = pattern.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(pattern.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < pattern.length()) {
            regex.append(Pattern.quote(pattern.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }
}
