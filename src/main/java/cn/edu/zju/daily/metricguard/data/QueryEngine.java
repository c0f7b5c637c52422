package cn.edu.zju.daily.metricguard.data;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Asynchronous access to named tables. Every failure, including an unknown table or column,
 * completes the returned future exceptionally with a {@link
 * cn.edu.zju.daily.metricguard.core.error.DataAccessException}.
 */
public interface QueryEngine {

    CompletableFuture<TableSchema> schema(String table);

    /** Computes all aggregates in one pass over the table. */
    CompletableFuture<AggregateResult> aggregate(String table, List<Aggregate> aggregates);

    /**
     * Streams the projected rows to {@code consumer}, in table order. Values appear in the order of
     * {@code columns}.
     *
     * @param limit maximum number of rows, or a negative number for all rows
     */
    CompletableFuture<Long> scan(
            String table, List<String> columns, long limit, Consumer<Object[]> consumer);
}
