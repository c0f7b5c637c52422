package cn.edu.zju.daily.metricguard.profiler;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/** Named regular expressions for common string formats. */
public class PatternLibrary {

    private static final Map<String, Pattern> DEFAULT_PATTERNS = new LinkedHashMap<>();

    static {
        DEFAULT_PATTERNS.put(
                "email",
                Pattern.compile(
                        "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+"
                                + "@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                                + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)+$"));
        DEFAULT_PATTERNS.put(
                "url",
                Pattern.compile(
                        "^https?://(?:localhost|[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}|(?:\\d{1,3}\\.){3}"
                                + "\\d{1,3})(?::\\d+)?(?:/\\S*)?$"));
        DEFAULT_PATTERNS.put(
                "uuid",
                Pattern.compile(
                        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[1-5][0-9a-fA-F]{3}-[89abAB][0-9a-fA-F]{3}"
                                + "-[0-9a-fA-F]{12}$"));
        DEFAULT_PATTERNS.put(
                "phone",
                Pattern.compile(
                        "^(\\+?1[-.\\s]?)?\\(?([0-9]{3})\\)?[-.\\s]?"
                                + "([0-9]{3})[-.\\s]?([0-9]{4})$"));
        DEFAULT_PATTERNS.put(
                "ipv4",
                Pattern.compile(
                        "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}"
                                + "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$"));
        DEFAULT_PATTERNS.put("us_zip", Pattern.compile("^\\d{5}(-\\d{4})?$"));
        DEFAULT_PATTERNS.put("date", TypeInferenceEngine.DATE_ISO);
        DEFAULT_PATTERNS.put("datetime", TypeInferenceEngine.DATETIME_ISO);
    }

    private final Map<String, Pattern> patterns;

    public PatternLibrary() {
        this(DEFAULT_PATTERNS);
    }

    public PatternLibrary(Map<String, Pattern> patterns) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    /** Adds or replaces a pattern, returning a new library. */
    public PatternLibrary with(String name, Pattern pattern) {
        Map<String, Pattern> copy = new LinkedHashMap<>(patterns);
        copy.put(name, pattern);
        return new PatternLibrary(copy);
    }

    public Map<String, Pattern> getPatterns() {
        return patterns;
    }

    /** Share of the values matching each pattern; patterns that never match are left out. */
    public Map<String, Double> match(Collection<String> values) {
        Map<String, Double> shares = new TreeMap<>();
        if (values.isEmpty()) {
            return shares;
        }
        for (Map.Entry<String, Pattern> e : patterns.entrySet()) {
            long matches = values.stream().filter(v -> e.getValue().matcher(v).matches()).count();
            if (matches > 0) {
                shares.put(e.getKey(), (double) matches / values.size());
            }
        }
        return shares;
    }
}
