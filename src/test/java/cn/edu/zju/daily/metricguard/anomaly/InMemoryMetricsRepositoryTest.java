package cn.edu.zju.daily.metricguard.anomaly;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.config.Parameters;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryMetricsRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Instant day(int n) {
        return T0.plusSeconds(86400L * n);
    }

    @Test
    void testRangeIsHalfOpen() {
        InMemoryMetricsRepository repository = new InMemoryMetricsRepository();
        for (int i = 0; i < 5; i++) {
            repository.store("size", i, day(i), Collections.emptyMap());
        }

        List<MetricPoint> history = repository.getHistory("size", day(1), day(3));
        assertEquals(2, history.size());
        assertEquals(1d, history.get(0).getValue());
        assertEquals(2d, history.get(1).getValue());
        assertTrue(repository.getHistory("other", day(0), day(9)).isEmpty());
    }

    @Test
    void testOutOfOrderStoresKeptSorted() {
        InMemoryMetricsRepository repository = new InMemoryMetricsRepository();
        repository.store("m", 3, day(3), Collections.emptyMap());
        repository.store("m", 1, day(1), Collections.emptyMap());
        repository.store("m", 2, day(2), Collections.emptyMap());

        List<MetricPoint> history = repository.getHistory("m", day(0), day(10));
        assertEquals(day(1), history.get(0).getTimestamp());
        assertEquals(day(3), history.get(2).getTimestamp());
    }

    @Test
    void testCapacityDropsOldest() {
        InMemoryMetricsRepository repository = new InMemoryMetricsRepository(3);
        for (int i = 0; i < 5; i++) {
            repository.store("m", i, day(i), Collections.emptyMap());
        }

        assertEquals(3, repository.size("m"));
        List<MetricPoint> history = repository.getHistory("m", day(0), day(10));
        assertEquals(2d, history.get(0).getValue());
        assertThrows(IllegalArgumentException.class, () -> new InMemoryMetricsRepository(0));
    }

    @Test
    void testCapacityFromParameters() {
        Parameters params = new Parameters();
        params.setRepositoryCapacity(2);
        InMemoryMetricsRepository repository = InMemoryMetricsRepository.fromParameters(params);
        for (int i = 0; i < 4; i++) {
            repository.store("m", i, day(i), Collections.emptyMap());
        }

        assertEquals(2, repository.size("m"));
        assertEquals(2d, repository.getHistory("m", day(0), day(10)).get(0).getValue());
    }
}
