package cn.edu.zju.daily.metricguard.anomaly.baseline;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.anomaly.DetectionResult;
import cn.edu.zju.daily.metricguard.anomaly.MetricPoint;
import cn.edu.zju.daily.metricguard.anomaly.detector.RelativeRateOfChangeDetector;
import cn.edu.zju.daily.metricguard.core.error.InsufficientHistoryException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class BaselinesTest {

    @Test
    void testMean() {
        assertEquals(2.5, new MeanBaseline().compute(Arrays.asList(1d, 2d, 3d, 4d)));
        assertThrows(
                InsufficientHistoryException.class,
                () -> new MeanBaseline().compute(Collections.emptyList()));
    }

    @Test
    void testWindowed() {
        WindowedBaseline baseline = new WindowedBaseline(2);
        assertEquals(6.5, baseline.compute(Arrays.asList(1d, 2d, 3d, 10d)));
        assertEquals(1d, baseline.compute(Collections.singletonList(1d)));
        assertThrows(IllegalArgumentException.class, () -> new WindowedBaseline(0));
    }

    @Test
    void testSeasonal() {
        SeasonalBaseline baseline = new SeasonalBaseline(3);
        // same phase as the next value: indices 3 and 0
        assertEquals(2.5, baseline.compute(Arrays.asList(1d, 2d, 3d, 4d, 5d, 6d)));
        assertEquals(2d, baseline.compute(Arrays.asList(2d, 7d, 9d)));
        assertThrows(
                InsufficientHistoryException.class,
                () -> baseline.compute(Arrays.asList(1d, 2d)));
    }

    @Test
    void testDetectorAbstainsWithoutSeasonalHistory() {
        RelativeRateOfChangeDetector detector =
                new RelativeRateOfChangeDetector(0.1, new SeasonalBaseline(7), 1);
        List<MetricPoint> history = new ArrayList<>();
        Instant t = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 3; i++) {
            history.add(new MetricPoint(t.plusSeconds(86400L * i), 10));
        }
        DetectionResult result = detector.detect("size", history, 50);
        assertEquals(DetectionResult.Status.INSUFFICIENT_DATA, result.getStatus());

        for (int i = 3; i < 7; i++) {
            history.add(new MetricPoint(t.plusSeconds(86400L * i), i == 6 ? 99 : 10));
        }
        assertTrue(detector.detect("size", history, 50).isAnomaly());
        assertFalse(detector.detect("size", history, 10.5).isAnomaly());
    }
}
