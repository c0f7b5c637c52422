package cn.edu.zju.daily.metricguard.data;

import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link QueryEngine} over registered {@link InMemoryTable}s. */
public class InMemoryQueryEngine implements QueryEngine {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryQueryEngine.class);

    private final Map<String, InMemoryTable> tables = new ConcurrentHashMap<>();
    private final Executor executor;

    public InMemoryQueryEngine() {
        this(ForkJoinPool.commonPool());
    }

    public InMemoryQueryEngine(Executor executor) {
        this.executor = executor;
    }

    public InMemoryQueryEngine register(InMemoryTable table) {
        tables.put(table.getName(), table);
        LOG.debug("Registered table {} with {} rows", table.getName(), table.numRows());
        return this;
    }

    public void deregister(String table) {
        tables.remove(table);
    }

    @Override
    public CompletableFuture<TableSchema> schema(String table) {
        return async(() -> lookup(table).getSchema());
    }

    @Override
    public CompletableFuture<AggregateResult> aggregate(String table, List<Aggregate> aggregates) {
        return async(() -> computeAggregates(lookup(table), aggregates));
    }

    @Override
    public CompletableFuture<Long> scan(
            String table, List<String> columns, long limit, Consumer<Object[]> consumer) {
        return async(
                () -> {
                    InMemoryTable t = lookup(table);
                    int[] indexes = indexes(t.getSchema(), columns);
                    long emitted = 0;
                    for (Object[] row : t.getRows()) {
                        if (limit >= 0 && emitted >= limit) {
                            break;
                        }
                        Object[] projected = new Object[indexes.length];
                        for (int i = 0; i < indexes.length; i++) {
                            projected[i] = row[indexes[i]];
                        }
                        consumer.accept(projected);
                        emitted++;
                    }
                    return emitted;
                });
    }

    private <T> CompletableFuture<T> async(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return supplier.get();
                    } catch (DataAccessException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        throw new DataAccessException("Query failed: " + e.getMessage(), e);
                    }
                },
                executor);
    }

    private InMemoryTable lookup(String table) {
        InMemoryTable t = tables.get(table);
        if (t == null) {
            throw new DataAccessException("Unknown table " + table);
        }
        return t;
    }

    private static int[] indexes(TableSchema schema, List<String> columns) {
        int[] indexes = new int[columns.size()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = schema.indexOf(columns.get(i));
        }
        return indexes;
    }

    private static AggregateResult computeAggregates(
            InMemoryTable table, List<Aggregate> aggregates) {
        Map<Aggregate, Object> results = new LinkedHashMap<>();
        for (Aggregate aggregate : aggregates) {
            results.put(aggregate, computeAggregate(table, aggregate));
        }
        return new AggregateResult(results);
    }

    private static Object computeAggregate(InMemoryTable table, Aggregate aggregate) {
        if (aggregate.getFunction() == AggregateFunction.COUNT_ROWS) {
            return (long) table.numRows();
        }
        TableSchema schema = table.getSchema();
        int index = schema.indexOf(aggregate.getColumn());
        ColumnType type = schema.typeOf(aggregate.getColumn());
        List<Object> values = new ArrayList<>();
        for (Object[] row : table.getRows()) {
            if (row[index] != null) {
                values.add(row[index]);
            }
        }
        switch (aggregate.getFunction()) {
            case COUNT_NON_NULL:
                return (long) values.size();
            case COUNT_DISTINCT:
                Set<String> distinct = new HashSet<>();
                for (Object v : values) {
                    distinct.add(HashUtils.canonical(v));
                }
                return (long) distinct.size();
            case SUM:
            case MIN:
            case MAX:
                if (!type.isNumeric()) {
                    throw new DataAccessException(
                            aggregate.getFunction()
                                    + " requires a numeric column, "
                                    + aggregate.getColumn()
                                    + " is "
                                    + type);
                }
                if (values.isEmpty()) {
                    return null;
                }
                double acc =
                        aggregate.getFunction() == AggregateFunction.SUM
                                ? 0d
                                : ((Number) values.get(0)).doubleValue();
                for (Object v : values) {
                    double d = ((Number) v).doubleValue();
                    if (aggregate.getFunction() == AggregateFunction.SUM) {
                        acc += d;
                    } else if (aggregate.getFunction() == AggregateFunction.MIN) {
                        acc = Math.min(acc, d);
                    } else {
                        acc = Math.max(acc, d);
                    }
                }
                return acc;
            default:
                throw new DataAccessException("Unsupported aggregate " + aggregate);
        }
    }
}
