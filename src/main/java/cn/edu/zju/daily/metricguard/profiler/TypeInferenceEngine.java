package cn.edu.zju.daily.metricguard.profiler;

import cn.edu.zju.daily.metricguard.data.ColumnType;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Infers the semantic type of a column by voting over sampled values. Typed columns (numbers,
 * booleans, dates) map directly to their type; string columns are matched against a set of
 * regular expressions and the type matched by at least {@code confidenceThreshold} of the non-null
 * samples wins. Temporal types take precedence over booleans, booleans over numbers.
 */
public class TypeInferenceEngine {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    static final Pattern DATE_ISO = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    static final Pattern DATE_US = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");
    static final Pattern DATE_EU = Pattern.compile("^\\d{1,2}\\.\\d{1,2}\\.\\d{4}$");
    static final Pattern DATETIME_ISO =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}.*$");
    static final Pattern BOOLEAN =
            Pattern.compile("(?i)^(true|false|t|f|yes|no|y|n|on|off)$");

    private static final double MIXED_MIN_SHARE = 0.1;

    private final double confidenceThreshold;

    public TypeInferenceEngine() {
        this(DEFAULT_CONFIDENCE_THRESHOLD);
    }

    public TypeInferenceEngine(double confidenceThreshold) {
        if (confidenceThreshold <= 0 || confidenceThreshold > 1) {
            throw new IllegalArgumentException(
                    "Confidence threshold must be in (0, 1], got " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    /** Type of a single non-null value. */
    public DetectedDataType classify(Object value) {
        if (value instanceof Boolean) {
            return DetectedDataType.BOOLEAN;
        }
        if (value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte) {
            return DetectedDataType.INTEGER;
        }
        if (value instanceof Number) {
            return DetectedDataType.DECIMAL;
        }
        if (value instanceof java.time.LocalDate) {
            return DetectedDataType.DATE;
        }
        if (value instanceof java.time.temporal.Temporal) {
            return DetectedDataType.TIMESTAMP;
        }
        return classifyString(HashUtils.canonical(value).trim());
    }

    DetectedDataType classifyString(String s) {
        if (s.isEmpty()) {
            return DetectedDataType.UNKNOWN;
        }
        if (DATETIME_ISO.matcher(s).matches()) {
            return DetectedDataType.TIMESTAMP;
        }
        if (dateFormat(s) != null) {
            return DetectedDataType.DATE;
        }
        if (BOOLEAN.matcher(s).matches()) {
            return DetectedDataType.BOOLEAN;
        }
        if (INTEGER.matcher(s).matches()) {
            return DetectedDataType.INTEGER;
        }
        if (DECIMAL.matcher(s).matches()) {
            return DetectedDataType.DECIMAL;
        }
        return DetectedDataType.STRING;
    }

    static String dateFormat(String s) {
        if (DATE_ISO.matcher(s).matches()) {
            return "YYYY-MM-DD";
        }
        if (DATE_US.matcher(s).matches()) {
            return "MM/DD/YYYY";
        }
        if (DATE_EU.matcher(s).matches()) {
            return "DD.MM.YYYY";
        }
        return null;
    }

    /**
     * Infers the type of a sample. A physical type other than {@link ColumnType#STRING} decides
     * the type outright with full confidence.
     */
    public TypeInference infer(List<?> samples, ColumnType physicalType) {
        int nulls = 0;
        for (Object v : samples) {
            if (v == null || (v instanceof String && StringUtils.isBlank((String) v))) {
                nulls++;
            }
        }
        int nonNull = samples.size() - nulls;
        if (nonNull == 0) {
            return new TypeInference(
                    DetectedDataType.UNKNOWN,
                    0d,
                    samples.size(),
                    nulls,
                    Collections.emptyMap(),
                    null);
        }
        if (physicalType != null && physicalType != ColumnType.STRING) {
            DetectedDataType type = fromPhysical(physicalType);
            Map<DetectedDataType, Double> alternatives = new EnumMap<>(DetectedDataType.class);
            alternatives.put(type, 1d);
            return new TypeInference(type, 1d, samples.size(), nulls, alternatives, null);
        }

        Map<DetectedDataType, Integer> votes = new EnumMap<>(DetectedDataType.class);
        Map<String, Integer> formats = new HashMap<>();
        for (Object v : samples) {
            if (v == null) {
                continue;
            }
            String s = HashUtils.canonical(v).trim();
            if (s.isEmpty()) {
                continue;
            }
            DetectedDataType type = classifyString(s);
            votes.merge(type, 1, Integer::sum);
            if (type == DetectedDataType.INTEGER) {
                // integers count as decimals too
                votes.merge(DetectedDataType.DECIMAL, 1, Integer::sum);
            } else if (type == DetectedDataType.DATE) {
                formats.merge(dateFormat(s), 1, Integer::sum);
            }
        }

        Map<DetectedDataType, Double> alternatives = new EnumMap<>(DetectedDataType.class);
        votes.forEach((type, count) -> alternatives.put(type, (double) count / nonNull));

        DetectedDataType[] priority = {
            DetectedDataType.TIMESTAMP,
            DetectedDataType.DATE,
            DetectedDataType.BOOLEAN,
            DetectedDataType.INTEGER,
            DetectedDataType.DECIMAL
        };
        for (DetectedDataType type : priority) {
            double share = alternatives.getOrDefault(type, 0d);
            if (share >= confidenceThreshold) {
                String format = type == DetectedDataType.DATE ? mostCommon(formats) : null;
                return new TypeInference(type, share, samples.size(), nulls, alternatives, format);
            }
        }

        long typedCandidates =
                alternatives.entrySet().stream()
                        .filter(e -> e.getKey() != DetectedDataType.STRING)
                        .filter(e -> e.getValue() > MIXED_MIN_SHARE)
                        .count();
        double stringShare = alternatives.getOrDefault(DetectedDataType.STRING, 0d);
        if (typedCandidates > 0 && stringShare < confidenceThreshold) {
            double best = alternatives.values().stream().mapToDouble(d -> d).max().orElse(0d);
            return new TypeInference(
                    DetectedDataType.MIXED, best, samples.size(), nulls, alternatives, null);
        }
        return new TypeInference(
                DetectedDataType.STRING, stringShare, samples.size(), nulls, alternatives, null);
    }

    private static DetectedDataType fromPhysical(ColumnType type) {
        switch (type) {
            case LONG:
                return DetectedDataType.INTEGER;
            case DOUBLE:
                return DetectedDataType.DECIMAL;
            case BOOLEAN:
                return DetectedDataType.BOOLEAN;
            case DATE:
                return DetectedDataType.DATE;
            case TIMESTAMP:
                return DetectedDataType.TIMESTAMP;
            default:
                return DetectedDataType.STRING;
        }
    }

    private static String mostCommon(Map<String, Integer> formats) {
        String best = null;
        int bestCount = -1;
        for (Map.Entry<String, Integer> e : formats.entrySet()) {
            if (e.getValue() > bestCount
                    || (e.getValue() == bestCount && e.getKey().compareTo(best) < 0)) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
