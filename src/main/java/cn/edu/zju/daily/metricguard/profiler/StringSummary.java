package cn.edu.zju.daily.metricguard.profiler;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Length statistics over all values and pattern shares over a reservoir sample. */
@Getter
@ToString
@EqualsAndHashCode
public final class StringSummary {

    private final int minLength;
    private final int maxLength;
    private final double meanLength;
    private final int sampleSize;
    private final Map<String, Double> patterns;

    public StringSummary(
            int minLength,
            int maxLength,
            double meanLength,
            int sampleSize,
            Map<String, Double> patterns) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.meanLength = meanLength;
        this.sampleSize = sampleSize;
        this.patterns = Collections.unmodifiableMap(new TreeMap<>(patterns));
    }

    /** Pattern matched by the largest share of the sample, if any. */
    public String dominantPattern() {
        return patterns.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);
    }
}
