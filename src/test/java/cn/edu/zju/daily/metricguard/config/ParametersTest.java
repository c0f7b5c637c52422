package cn.edu.zju.daily.metricguard.config;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.anomaly.AnomalyDetectionConfig;
import cn.edu.zju.daily.metricguard.core.error.MetricGuardException;
import cn.edu.zju.daily.metricguard.incremental.DuplicatePartitionPolicy;
import cn.edu.zju.daily.metricguard.incremental.IncrementalConfig;
import cn.edu.zju.daily.metricguard.profiler.ProfilerConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParametersTest {

    @Test
    void testLoadDefault() {
        Parameters params = Parameters.loadDefault();
        assertEquals(12, params.getHllPrecision());
        assertEquals(200, params.getKllK());
        assertEquals(7, params.getQuantiles().size());
        assertEquals("REJECT", params.getDuplicatePartitionPolicy());
        assertNull(params.getStateStoreDirectory());
        assertTrue(params.isContinueOnError());
    }

    @Test
    void testLoadResourceOverrides() {
        Parameters params = Parameters.load("metricguard-test.yaml", true);
        assertEquals(10, params.getHllPrecision());
        assertEquals(5, params.getHistogramTopN());
        assertEquals(2, params.getQuantiles().size());
        // unset keys keep their defaults
        assertEquals(200, params.getKllK());
        assertEquals(100, params.getHistoryLimit());

        ProfilerConfig profiler = ProfilerConfig.fromParameters(params);
        assertEquals(10, profiler.getHllPrecision());
        assertArrayEquals(new double[] {0.5, 0.9}, profiler.getQuantiles());

        IncrementalConfig incremental = IncrementalConfig.fromParameters(params);
        assertEquals(DuplicatePartitionPolicy.SKIP, incremental.getDuplicatePolicy());
        assertEquals(4, incremental.getMaxConcurrency());

        AnomalyDetectionConfig anomaly = AnomalyDetectionConfig.fromParameters(params);
        assertEquals(0.8, anomaly.getMinConfidence());
        assertEquals(Duration.ofDays(7), anomaly.getHistoryWindow());
    }

    @Test
    void testLoadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("params.yaml");
        Files.write(file, "kllK: 64\nrandomSeed: 7\n".getBytes(StandardCharsets.UTF_8));
        Parameters params = Parameters.load(file.toString(), false);
        assertEquals(64, params.getKllK());
        assertEquals(7L, params.getRandomSeed());

        Path empty = dir.resolve("empty.yaml");
        Files.write(empty, new byte[0]);
        assertEquals(new Parameters(), Parameters.load(empty.toString(), false));
    }

    @Test
    void testMissingSources() {
        assertThrows(MetricGuardException.class, () -> Parameters.load("nope.yaml", true));
        assertThrows(
                MetricGuardException.class,
                () -> Parameters.load("/nonexistent/dir/params.yaml", false));
    }
}
