package cn.edu.zju.daily.metricguard.runner;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.analyzer.basic.CompletenessAnalyzer;
import cn.edu.zju.daily.metricguard.analyzer.basic.MaxAnalyzer;
import cn.edu.zju.daily.metricguard.analyzer.basic.MeanAnalyzer;
import cn.edu.zju.daily.metricguard.analyzer.basic.SizeAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.AnalysisAbortedException;
import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.MeanState;
import cn.edu.zju.daily.metricguard.data.ColumnType;
import cn.edu.zju.daily.metricguard.data.InMemoryQueryEngine;
import cn.edu.zju.daily.metricguard.data.InMemoryTable;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalysisRunnerTest {

    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        InMemoryQueryEngine engine = new InMemoryQueryEngine();
        engine.register(
                InMemoryTable.builder("t")
                        .column("x", ColumnType.LONG)
                        .row(1L)
                        .row(5L)
                        .row((Object) null)
                        .build());
        context = new ExecutionContext(engine, "t");
    }

    @Test
    void testAllAnalyzersSucceed() {
        AnalyzerContext result =
                AnalysisRunner.builder()
                        .addAnalyzer(new SizeAnalyzer())
                        .addAnalyzer(new CompletenessAnalyzer("x"))
                        .addAnalyzer(new MaxAnalyzer("x"))
                        .build()
                        .run(context);

        assertEquals(RunStatus.SUCCESS, result.status());
        assertEquals(MetricValue.of(3L), result.getMetric("size").get());
        assertEquals(2d / 3, result.getMetric("completeness.x").get().asDouble().getAsDouble());
        assertEquals(MetricValue.of(5d), result.getMetric("max.x").get());
        assertEquals(
                Arrays.asList("completeness.x", "max.x", "size"),
                new ArrayList<>(result.getMetrics().keySet()));
        assertEquals(1, result.getAnalyzerMetrics("max.").size());
        assertEquals("t", result.getMetadata().getTable());
    }

    @Test
    void testFailureIsIsolated() {
        AnalyzerContext result =
                AnalysisRunner.builder()
                        .addAnalyzer(new SizeAnalyzer())
                        .addAnalyzer(new MeanAnalyzer("missing"))
                        .addAnalyzer(new MaxAnalyzer("x"))
                        .build()
                        .run(context);

        assertEquals(RunStatus.COMPLETED_WITH_ERRORS, result.status());
        assertEquals(2, result.getMetrics().size());
        assertTrue(result.getMetric("size").isPresent());
        assertTrue(result.getMetric("max.x").isPresent());
        assertFalse(result.getMetric("mean.missing").isPresent());

        assertEquals(1, result.getErrors().size());
        AnalysisError error = result.getErrors().get(0);
        assertEquals("mean.missing", error.getMetricKey());
        assertEquals(MeanAnalyzer.NAME, error.getAnalyzerName());
        assertEquals(Collections.singletonList("missing"), error.getColumns());
        assertEquals(DataAccessException.class.getSimpleName(), error.getErrorType());
        assertTrue(result.summary().contains("mean.missing"));
    }

    @Test
    void testAbortOnError() {
        AnalysisRunner runner =
                AnalysisRunner.builder()
                        .addAnalyzer(new MeanAnalyzer("missing"))
                        .addAnalyzer(new SizeAnalyzer())
                        .continueOnError(false)
                        .build();
        AnalysisAbortedException e =
                assertThrows(AnalysisAbortedException.class, () -> runner.run(context));
        assertTrue(e.getCause() instanceof DataAccessException);
    }

    @Test
    void testDuplicateMetricKey() {
        AnalysisRunner.Builder builder =
                AnalysisRunner.builder().addAnalyzer(new MeanAnalyzer("x"));
        assertThrows(IllegalStateException.class, () -> builder.addAnalyzer(new MeanAnalyzer("x")));
    }

    @Test
    void testProgressAndCancellation() {
        CancellationToken token = CancellationToken.create();
        List<Double> progress = new ArrayList<>();
        AnalyzerContext result =
                AnalysisRunner.builder()
                        .addAnalyzer(new SizeAnalyzer())
                        .addAnalyzer(new MaxAnalyzer("x"))
                        .addAnalyzer(new MeanAnalyzer("x"))
                        .onProgress(
                                p -> {
                                    progress.add(p);
                                    token.cancel();
                                })
                        .cancellationToken(token)
                        .build()
                        .run(context);

        assertEquals(RunStatus.CANCELLED, result.status());
        assertEquals(Collections.singletonList(1d / 3), progress);
        assertEquals(Arrays.asList("max.x", "mean.x"), result.getCancelled());
        assertEquals(MetricValue.of(3L), result.getMetric("size").get());
    }

    @Test
    void testExpiredDeadline() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        CancellationToken token =
                CancellationToken.withDeadline(Instant.parse("2023-12-31T00:00:00Z"), clock);
        AnalyzerContext result =
                AnalysisRunner.builder()
                        .addAnalyzer(new SizeAnalyzer())
                        .cancellationToken(token)
                        .build()
                        .run(context);
        assertEquals(RunStatus.CANCELLED, result.status());
        assertTrue(result.getMetrics().isEmpty());
    }

    @Test
    void testFailingProgressCallbackIsIgnored() {
        AnalyzerContext result =
                AnalysisRunner.builder()
                        .addAnalyzer(new SizeAnalyzer())
                        .addAnalyzer(new MaxAnalyzer("x"))
                        .onProgress(
                                p -> {
                                    throw new IllegalStateException("boom");
                                })
                        .build()
                        .run(context);
        assertEquals(RunStatus.SUCCESS, result.status());
        assertEquals(2, result.getMetrics().size());
    }

    @Test
    void testExecutionRejectsForeignState() {
        AnalyzerExecution execution = AnalyzerExecution.wrap(new MaxAnalyzer("x"));
        assertThrows(
                StateIncompatibilityException.class,
                () -> execution.merge(MeanState.EMPTY, MeanState.EMPTY));
    }
}
