package cn.edu.zju.daily.metricguard.incremental;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.analyzer.basic.MeanAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.StoreException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.data.ColumnType;
import cn.edu.zju.daily.metricguard.data.InMemoryQueryEngine;
import cn.edu.zju.daily.metricguard.data.InMemoryTable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemStateStoreTest {

    @TempDir Path dir;

    @Test
    void testSaveLoadAndOverwrite() {
        FileSystemStateStore store = new FileSystemStateStore(dir.resolve("states"));
        Map<String, byte[]> states = new LinkedHashMap<>();
        states.put("mean.v", new byte[] {1, 2, 3});
        states.put("size", new byte[0]);
        store.saveState("orders@2024/01", states);

        Map<String, byte[]> loaded = store.loadState("orders@2024/01").get();
        assertEquals(2, loaded.size());
        assertArrayEquals(new byte[] {1, 2, 3}, loaded.get("mean.v"));
        assertArrayEquals(new byte[0], loaded.get("size"));

        store.saveState("orders@2024/01", Collections.singletonMap("size", new byte[] {9}));
        loaded = store.loadState("orders@2024/01").get();
        assertEquals(Collections.singleton("size"), loaded.keySet());
        Path entry = dir.resolve("states").resolve("orders%402024%2F01");
        assertTrue(Files.exists(entry.resolve(FileSystemStateStore.STATE_FILE)));
        assertFalse(Files.exists(entry.resolve("state.json.tmp")));
    }

    @Test
    void testListAndDelete() {
        FileSystemStateStore store = new FileSystemStateStore(dir);
        store.saveState("b", Collections.emptyMap());
        store.saveState("a@1", Collections.emptyMap());
        store.saveState("a", Collections.emptyMap());

        assertEquals(Arrays.asList("a", "a@1", "b"), store.listPartitions());
        store.deleteState("a@1");
        store.deleteState("never-saved");
        assertEquals(Arrays.asList("a", "b"), store.listPartitions());
        assertFalse(store.loadState("a@1").isPresent());
    }

    @Test
    void testCorruptFile() throws IOException {
        FileSystemStateStore store = new FileSystemStateStore(dir);
        store.saveState("k", Collections.emptyMap());
        Path file = dir.resolve("k").resolve(FileSystemStateStore.STATE_FILE);
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        assertThrows(StoreException.class, () -> store.loadState("k"));
    }

    @Test
    void testInvalidKey() {
        FileSystemStateStore store = new FileSystemStateStore(dir);
        assertThrows(IllegalArgumentException.class, () -> store.loadState(""));
        assertThrows(
                IllegalArgumentException.class,
                () -> store.saveState("..", Collections.emptyMap()));
    }

    @Test
    void testSeriesSurvivesRestart() {
        InMemoryQueryEngine engine = new InMemoryQueryEngine();
        engine.register(InMemoryTable.ofColumn("a", "v", ColumnType.LONG, Arrays.asList(1L, 3L)));
        engine.register(InMemoryTable.ofColumn("b", "v", ColumnType.LONG, Arrays.asList(8L)));

        IncrementalAnalysisRunner.builder(new FileSystemStateStore(dir), "series")
                .addAnalyzer(new MeanAnalyzer("v"))
                .build()
                .processPartition("p1", new ExecutionContext(engine, "a"));

        IncrementalAnalysisRunner restarted =
                IncrementalAnalysisRunner.builder(new FileSystemStateStore(dir), "series")
                        .addAnalyzer(new MeanAnalyzer("v"))
                        .build();
        assertEquals(Collections.singletonList("p1"), restarted.processedPartitions());
        restarted.processPartition("p2", new ExecutionContext(engine, "b"));
        assertEquals(
                MetricValue.of(4d), restarted.computeMetrics().getMetric("mean.v").get());
    }
}
