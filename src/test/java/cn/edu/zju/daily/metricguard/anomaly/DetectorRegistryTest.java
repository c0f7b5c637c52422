package cn.edu.zju.daily.metricguard.anomaly;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.anomaly.detector.AbsoluteChangeDetector;
import cn.edu.zju.daily.metricguard.anomaly.detector.ZScoreDetector;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class DetectorRegistryTest {

    @Test
    void testWildcardPatterns() {
        Pattern prefix = DetectorRegistry.compile("completeness.*");
        assertTrue(prefix.matcher("completeness.email").matches());
        assertFalse(prefix.matcher("size").matches());

        Pattern suffix = DetectorRegistry.compile("*.email");
        assertTrue(suffix.matcher("distinctness.email").matches());

        Pattern literal = DetectorRegistry.compile("mean.v");
        assertTrue(literal.matcher("mean.v").matches());
        assertFalse(literal.matcher("meanXv").matches());

        assertTrue(DetectorRegistry.compile("*").matcher("").matches());
        assertThrows(IllegalArgumentException.class, () -> DetectorRegistry.compile(""));
    }

    @Test
    void testRegistrationOrder() {
        DetectorRegistry registry = new DetectorRegistry();
        AbsoluteChangeDetector absolute = new AbsoluteChangeDetector(1);
        ZScoreDetector zScore = new ZScoreDetector(3);
        registry.register("*", zScore).register("size", absolute);

        assertEquals(2, registry.detectorsFor("size").size());
        assertSame(zScore, registry.detectorsFor("size").get(0));
        assertSame(absolute, registry.detectorsFor("size").get(1));
        assertEquals(1, registry.detectorsFor("mean.v").size());
        assertEquals(2, registry.getPatterns().size());
    }

    @Test
    void testSeverityFromRatio() {
        assertEquals(Severity.INFO, Severity.fromRatio(1.1));
        assertEquals(Severity.WARNING, Severity.fromRatio(1.25));
        assertEquals(Severity.WARNING, Severity.fromRatio(1.9));
        assertEquals(Severity.CRITICAL, Severity.fromRatio(2));
    }
}
