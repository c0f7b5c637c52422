package cn.edu.zju.daily.metricguard.data;

import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.ToString;

/**
 * Values of an aggregation query, keyed by aggregate. Counts are longs; sums, minima and maxima are
 * doubles and are null when no non-null value was aggregated.
 */
@ToString
public final class AggregateResult {

    private final Map<Aggregate, Object> values;

    public AggregateResult(Map<Aggregate, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(Aggregate aggregate) {
        if (!values.containsKey(aggregate)) {
            throw new DataAccessException("Aggregate " + aggregate + " was not computed");
        }
        return values.get(aggregate);
    }

    public long getLong(Aggregate aggregate) {
        Object value = get(aggregate);
        return value == null ? 0L : ((Number) value).longValue();
    }

    /** NaN for a null aggregate. */
    public double getDouble(Aggregate aggregate) {
        Object value = get(aggregate);
        return value == null ? Double.NaN : ((Number) value).doubleValue();
    }
}
