package cn.edu.zju.daily.metricguard.analyzer.basic;

import static cn.edu.zju.daily.metricguard.utils.FutureUtils.await;
import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.analyzer.Analyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import cn.edu.zju.daily.metricguard.core.state.MeanState;
import cn.edu.zju.daily.metricguard.data.ColumnType;
import cn.edu.zju.daily.metricguard.data.InMemoryQueryEngine;
import cn.edu.zju.daily.metricguard.data.InMemoryTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BasicAnalyzersTest {

    private static final double EPS = 1e-9;

    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        InMemoryQueryEngine engine = new InMemoryQueryEngine();
        engine.register(
                InMemoryTable.builder("t")
                        .column("x", ColumnType.DOUBLE)
                        .column("n", ColumnType.LONG)
                        .column("empty", ColumnType.DOUBLE)
                        .row(1.0, 10L, null)
                        .row(2.0, 20L, null)
                        .row(3.0, null, null)
                        .row(4.0, 30L, null)
                        .row(null, 40L, null)
                        .build());
        context = new ExecutionContext(engine, "t");
    }

    private <S extends AnalyzerState<S>> double value(Analyzer<S> analyzer) {
        S state = await(analyzer.computeState(context));
        return analyzer.computeMetric(state).asDouble().getAsDouble();
    }

    @Test
    void testSize() {
        SizeAnalyzer size = new SizeAnalyzer();
        assertEquals("size", size.metricKey());
        assertTrue(size.columns().isEmpty());
        MetricValue metric = size.computeMetric(await(size.computeState(context)));
        assertEquals(MetricValue.of(5L), metric);
    }

    @Test
    void testCompleteness() {
        assertEquals("completeness.x", new CompletenessAnalyzer("x").metricKey());
        assertEquals(0.8, value(new CompletenessAnalyzer("x")), EPS);
        assertEquals(0d, value(new CompletenessAnalyzer("empty")), EPS);
    }

    @Test
    void testMeanSumMinMax() {
        assertEquals(2.5, value(new MeanAnalyzer("x")), EPS);
        assertEquals(10d, value(new SumAnalyzer("x")), EPS);
        assertEquals(1d, value(new MinAnalyzer("x")), EPS);
        assertEquals(4d, value(new MaxAnalyzer("x")), EPS);
        assertEquals(25d, value(new MeanAnalyzer("n")), EPS);
        assertEquals(40d, value(new MaxAnalyzer("n")), EPS);
    }

    @Test
    void testStandardDeviation() {
        assertEquals(Math.sqrt(1.25), value(new StandardDeviationAnalyzer("x")), EPS);
        assertEquals(Math.sqrt(125), value(new StandardDeviationAnalyzer("n")), EPS);
    }

    @Test
    void testColumnWithoutValues() {
        assertTrue(Double.isNaN(value(new MeanAnalyzer("empty"))));
        assertTrue(Double.isNaN(value(new MinAnalyzer("empty"))));
        assertTrue(Double.isNaN(value(new MaxAnalyzer("empty"))));
        assertTrue(Double.isNaN(value(new StandardDeviationAnalyzer("empty"))));
        assertEquals(0d, value(new SumAnalyzer("empty")), EPS);
    }

    @Test
    void testStatesMergeAcrossPartitions() {
        InMemoryQueryEngine engine = new InMemoryQueryEngine();
        engine.register(
                InMemoryTable.builder("a").column("v", ColumnType.LONG).row(10L).row(20L).build());
        engine.register(InMemoryTable.builder("b").column("v", ColumnType.LONG).row(30L).build());
        MeanAnalyzer mean = new MeanAnalyzer("v");

        MeanState a = await(mean.computeState(new ExecutionContext(engine, "a")));
        MeanState b = await(mean.computeState(new ExecutionContext(engine, "b")));
        MeanState merged = a.merge(b);

        assertEquals(MetricValue.of(20d), mean.computeMetric(merged));
        assertEquals(merged, mean.emptyState().merge(merged));
    }

    @Test
    void testMissingColumn() {
        MeanAnalyzer mean = new MeanAnalyzer("nope");
        assertThrows(DataAccessException.class, () -> await(mean.computeState(context)));
    }

    @Test
    void testBlankColumnRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MeanAnalyzer(" "));
    }
}
