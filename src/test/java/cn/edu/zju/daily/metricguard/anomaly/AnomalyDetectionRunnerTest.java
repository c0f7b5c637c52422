package cn.edu.zju.daily.metricguard.anomaly;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.anomaly.detector.AbsoluteChangeDetector;
import cn.edu.zju.daily.metricguard.anomaly.detector.CustomDetector;
import cn.edu.zju.daily.metricguard.anomaly.detector.RelativeRateOfChangeDetector;
import cn.edu.zju.daily.metricguard.anomaly.detector.ZScoreDetector;
import cn.edu.zju.daily.metricguard.config.Parameters;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.runner.AnalyzerContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnomalyDetectionRunnerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryMetricsRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMetricsRepository();
    }

    private void seed(String metric, double... values) {
        for (int i = 0; i < values.length; i++) {
            Instant t = NOW.minus(Duration.ofDays(values.length - i));
            repository.store(metric, values[i], t, Collections.emptyMap());
        }
    }

    private AnomalyDetectionRunner.Builder runner() {
        return AnomalyDetectionRunner.builder(repository).clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, MetricValue> metrics(String key, double value) {
        Map<String, MetricValue> metrics = new LinkedHashMap<>();
        metrics.put(key, MetricValue.of(value));
        return metrics;
    }

    @Test
    void testUnionOfMatchingDetectors() {
        seed("size", 100, 100, 100);
        AnomalyDetectionRunner runner =
                runner().addDetector("size", new RelativeRateOfChangeDetector(0.1))
                        .addDetector("*", new AbsoluteChangeDetector(5))
                        .build();

        AnomalyReport report = runner.detect(metrics("size", 200), Collections.emptyMap());

        assertTrue(report.hasAnomalies());
        List<Anomaly> found = report.getAnomalies("size");
        assertEquals(2, found.size());
        assertEquals(RelativeRateOfChangeDetector.NAME, found.get(0).getDetector());
        assertEquals(AbsoluteChangeDetector.NAME, found.get(1).getDetector());
        assertFalse(report.hasErrors());
    }

    @Test
    void testDetectFromAnalyzerContext() {
        seed("completeness.email", 1, 1, 1);
        AnomalyDetectionRunner runner =
                runner().addDetector("completeness.*", new AbsoluteChangeDetector(0.05)).build();
        AnalyzerContext context =
                AnalyzerContext.builder("users")
                        .metric("completeness.email", MetricValue.of(0.5))
                        .metric("size", MetricValue.of(10L))
                        .metric("histogram.c", MetricValue.distribution(Collections.emptyMap()))
                        .build();

        AnomalyReport report = runner.detect(context);

        assertEquals(1, report.getAnomalies().size());
        assertEquals("completeness.email", report.getAnomalies().get(0).getMetricName());
        // the distribution is not numeric and is never stored
        assertEquals(4, repository.size("completeness.email"));
        assertEquals(1, repository.size("size"));
        assertEquals(0, repository.size("histogram.c"));
    }

    @Test
    void testLowConfidenceDropped() {
        seed("size", 100, 100);
        AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        config.setMinConfidence(0.8);
        AnomalyDetectionRunner runner =
                runner().addDetector("size", new RelativeRateOfChangeDetector(0.1))
                        .config(config)
                        .build();

        // 12% change, 1.2 times the threshold: confidence 0.6
        assertFalse(runner.detect(metrics("size", 112), Collections.emptyMap()).hasAnomalies());
        // 30% change: confidence 1
        assertTrue(runner.detect(metrics("size", 130), Collections.emptyMap()).hasAnomalies());
    }

    @Test
    void testAbstentionReported() {
        seed("mean.v", 1, 2, 3, 4, 5);
        AnomalyDetectionRunner runner =
                runner().addDetector("mean.*", new ZScoreDetector(3, 20)).build();

        AnomalyReport report = runner.detect(metrics("mean.v", 100), Collections.emptyMap());

        assertFalse(report.hasAnomalies());
        assertEquals(1, report.getAbstentions().size());
        AnomalyReport.Abstention abstention = report.getAbstentions().get(0);
        assertEquals("mean.v", abstention.getMetricName());
        assertEquals(ZScoreDetector.NAME, abstention.getDetector());
        assertTrue(abstention.getReason().contains("5 points"));
    }

    @Test
    void testDetectorErrorIsolated() {
        seed("size", 10, 10);
        CustomDetector broken =
                new CustomDetector(
                        "broken",
                        (metric, history, current) -> {
                            throw new IllegalStateException("boom");
                        });
        AnomalyDetectionRunner runner =
                runner().addDetector("size", broken)
                        .addDetector("size", new AbsoluteChangeDetector(1))
                        .build();

        AnomalyReport report = runner.detect(metrics("size", 20), Collections.emptyMap());

        assertTrue(report.hasErrors());
        AnomalyReport.DetectorError error = report.getErrors().get(0);
        assertEquals("broken", error.getDetector());
        assertEquals("IllegalStateException", error.getErrorType());
        assertEquals("boom", error.getMessage());
        assertEquals(1, report.getAnomalies().size());
        assertEquals(3, repository.size("size"));
    }

    @Test
    void testHistoryExcludesCurrentValue() {
        List<Integer> seen = new ArrayList<>();
        CustomDetector recorder =
                new CustomDetector(
                        "recorder",
                        (metric, history, current) -> {
                            seen.add(history.size());
                            return Optional.empty();
                        });
        seed("size", 1, 2);
        AnomalyDetectionRunner runner = runner().addDetector("size", recorder).build();

        runner.detect(metrics("size", 3), Collections.emptyMap());
        runner.detect(metrics("size", 3), Collections.emptyMap());

        // values stored at the detection instant fall outside [from, now)
        assertEquals(List.of(2, 2), seen);
        assertEquals(4, repository.size("size"));
    }

    @Test
    void testHistoryWindowAndLimit() {
        List<List<Double>> seen = new ArrayList<>();
        CustomDetector recorder =
                new CustomDetector(
                        "recorder",
                        (metric, history, current) -> {
                            seen.add(new ArrayList<>(history));
                            return Optional.empty();
                        });
        repository.store("m", 99, NOW.minus(Duration.ofDays(40)), Collections.emptyMap());
        seed("m", 1, 2, 3, 4);
        AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        config.setHistoryLimit(3);
        config.setStoreCurrentMetrics(false);
        AnomalyDetectionRunner runner =
                runner().addDetector("m", recorder).config(config).build();

        runner.detect(metrics("m", 5), Collections.emptyMap());

        assertEquals(List.of(2d, 3d, 4d), seen.get(0));
        assertEquals(5, repository.size("m"));
    }

    @Test
    void testUnmatchedMetricStoredOnly() {
        AnomalyDetectionRunner runner =
                runner().addDetector("size", new AbsoluteChangeDetector(1)).build();
        Map<String, String> tags = Collections.singletonMap("table", "users");

        AnomalyReport report = runner.detect(metrics("mean.v", 3), tags);

        assertFalse(report.hasAnomalies());
        assertTrue(report.getAbstentions().isEmpty());
        List<MetricPoint> stored = repository.getHistory("mean.v", NOW, NOW.plusSeconds(1));
        assertEquals(1, stored.size());
        assertEquals("users", stored.get(0).getTags().get("table"));
    }

    @Test
    void testConfigFromParameters() {
        Parameters params = new Parameters();
        params.setMinConfidence(0.9);
        params.setHistoryWindowDays(7);
        params.setHistoryLimit(5);
        params.setStoreCurrentMetrics(false);

        AnomalyDetectionConfig config = AnomalyDetectionConfig.fromParameters(params);

        assertEquals(0.9, config.getMinConfidence());
        assertEquals(Duration.ofDays(7), config.getHistoryWindow());
        assertEquals(5, config.getHistoryLimit());
        assertFalse(config.isStoreCurrentMetrics());
    }
}
