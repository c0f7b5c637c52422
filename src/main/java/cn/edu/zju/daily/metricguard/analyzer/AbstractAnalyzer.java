package cn.edu.zju.daily.metricguard.analyzer;

import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateResult;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;

/** Holds the name, qualifier and columns shared by all built-in analyzers. */
public abstract class AbstractAnalyzer<S extends AnalyzerState<S>> implements Analyzer<S> {

    private final String name;
    private final String qualifier;
    private final List<String> columns;
    private final Class<S> stateClass;

    protected AbstractAnalyzer(
            String name, String qualifier, List<String> columns, Class<S> stateClass) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Analyzer name must not be blank");
        }
        for (String column : columns) {
            if (StringUtils.isBlank(column)) {
                throw new IllegalArgumentException("Column name must not be blank");
            }
        }
        this.name = name;
        this.qualifier = qualifier;
        this.columns = Collections.unmodifiableList(columns);
        this.stateClass = stateClass;
    }

    protected AbstractAnalyzer(String name, String column, Class<S> stateClass) {
        this(name, column, Collections.singletonList(column), stateClass);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String metricKey() {
        return StringUtils.isEmpty(qualifier) ? name : name + "." + qualifier;
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public Class<S> stateClass() {
        return stateClass;
    }

    /** The single column of a column analyzer. */
    protected String column() {
        return columns.get(0);
    }

    protected CompletableFuture<AggregateResult> aggregate(
            ExecutionContext context, List<Aggregate> aggregates) {
        return context.getEngine().aggregate(context.getTable(), aggregates);
    }

    /** Streams all rows of {@link #columns()}. */
    protected CompletableFuture<Long> scan(ExecutionContext context, Consumer<Object[]> consumer) {
        return context.getEngine().scan(context.getTable(), columns, -1, consumer);
    }

    /** Numeric value of a scanned cell. */
    protected static double numeric(Object value, String column) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new DataAccessException(
                "Column " + column + " holds a non-numeric value " + value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + metricKey() + ")";
    }
}
