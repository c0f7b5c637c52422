package cn.edu.zju.daily.metricguard.data;

import static cn.edu.zju.daily.metricguard.utils.FutureUtils.await;
import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryQueryEngineTest {

    private InMemoryQueryEngine engine;

    @BeforeEach
    void setUp() {
        engine = new InMemoryQueryEngine();
        engine.register(
                InMemoryTable.builder("orders")
                        .column("id", ColumnType.LONG)
                        .column("amount", ColumnType.DOUBLE)
                        .column("status", ColumnType.STRING)
                        .row(1L, 10.0, "open")
                        .row(2L, null, "closed")
                        .row(3L, 30.0, "open")
                        .row(4L, 5.0, null)
                        .build());
    }

    @Test
    void testSchema() {
        TableSchema schema = await(engine.schema("orders"));
        assertEquals(Arrays.asList("id", "amount", "status"), schema.columnNames());
        assertEquals(ColumnType.DOUBLE, schema.typeOf("amount"));
        assertEquals(2, schema.indexOf("status"));
        assertFalse(schema.hasColumn("missing"));
    }

    @Test
    void testAggregates() {
        Aggregate rows = Aggregate.countRows();
        Aggregate nonNull = Aggregate.of(AggregateFunction.COUNT_NON_NULL, "amount");
        Aggregate distinct = Aggregate.of(AggregateFunction.COUNT_DISTINCT, "status");
        Aggregate sum = Aggregate.of(AggregateFunction.SUM, "amount");
        Aggregate min = Aggregate.of(AggregateFunction.MIN, "amount");
        Aggregate max = Aggregate.of(AggregateFunction.MAX, "amount");

        List<Aggregate> aggregates = Arrays.asList(rows, nonNull, distinct, sum, min, max);
        AggregateResult result = await(engine.aggregate("orders", aggregates));

        assertEquals(4L, result.getLong(rows));
        assertEquals(3L, result.getLong(nonNull));
        assertEquals(2L, result.getLong(distinct));
        assertEquals(45d, result.getDouble(sum));
        assertEquals(5d, result.getDouble(min));
        assertEquals(30d, result.getDouble(max));
    }

    @Test
    void testNumericAggregateOnStringColumn() {
        Aggregate sum = Aggregate.of(AggregateFunction.SUM, "status");
        assertThrows(
                DataAccessException.class,
                () -> await(engine.aggregate("orders", Collections.singletonList(sum))));
    }

    @Test
    void testScanWithLimit() {
        List<Object> seen = new ArrayList<>();
        long emitted =
                await(engine.scan("orders", Arrays.asList("status", "id"), 2, r -> seen.add(r[1])));
        assertEquals(2L, emitted);
        assertEquals(Arrays.<Object>asList(1L, 2L), seen);

        seen.clear();
        emitted = await(engine.scan("orders", Arrays.asList("id"), -1, r -> seen.add(r[0])));
        assertEquals(4L, emitted);
    }

    @Test
    void testUnknownTableAndColumn() {
        assertThrows(DataAccessException.class, () -> await(engine.schema("nope")));
        assertThrows(
                DataAccessException.class,
                () -> await(engine.scan("orders", Arrays.asList("nope"), -1, r -> {})));

        engine.deregister("orders");
        assertThrows(DataAccessException.class, () -> await(engine.schema("orders")));
    }

    @Test
    void testRowWidthChecked() {
        InMemoryTable.Builder builder =
                InMemoryTable.builder("bad").column("a", ColumnType.LONG).row(1L, 2L);
        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
