package cn.edu.zju.daily.metricguard.incremental;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetentionPolicyTest {

    private static final List<String> KEYS =
            Arrays.asList("2024-01-03", "2024-01-01", "2024-01-04", "2024-01-02");

    @Test
    void testKeepLatest() {
        List<String> expired = RetentionPolicy.keepLatest(2).select(KEYS);
        assertEquals(Arrays.asList("2024-01-01", "2024-01-02"), expired);
        assertEquals(Collections.emptyList(), RetentionPolicy.keepLatest(10).select(KEYS));
        assertEquals(4, RetentionPolicy.keepLatest(0).select(KEYS).size());
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicy.keepLatest(-1));
    }

    @Test
    void testOlderThan() {
        assertEquals(
                Arrays.asList("2024-01-01", "2024-01-02"),
                RetentionPolicy.olderThan("2024-01-03").select(KEYS));
        assertTrue(RetentionPolicy.olderThan("2023").select(KEYS).isEmpty());
    }
}
