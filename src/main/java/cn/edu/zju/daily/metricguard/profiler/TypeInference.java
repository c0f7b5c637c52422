package cn.edu.zju.daily.metricguard.profiler;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Outcome of type inference over a sample. */
@Getter
@ToString
@EqualsAndHashCode
public final class TypeInference {

    private final DetectedDataType type;
    private final double confidence;
    private final int samplesAnalyzed;
    private final int nullCount;

    /** Share of non-null samples matching each candidate type. */
    private final Map<DetectedDataType, Double> alternatives;

    /** Most common format for temporal types, otherwise null. */
    private final String format;

    public TypeInference(
            DetectedDataType type,
            double confidence,
            int samplesAnalyzed,
            int nullCount,
            Map<DetectedDataType, Double> alternatives,
            String format) {
        this.type = type;
        this.confidence = confidence;
        this.samplesAnalyzed = samplesAnalyzed;
        this.nullCount = nullCount;
        this.alternatives = Collections.unmodifiableMap(new TreeMap<>(alternatives));
        this.format = format;
    }
}
