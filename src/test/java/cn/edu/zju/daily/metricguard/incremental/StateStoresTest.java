package cn.edu.zju.daily.metricguard.incremental;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.config.Parameters;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StateStoresTest {

    @Test
    void testInMemoryWhenDirectoryUnset() {
        Parameters params = new Parameters();
        assertTrue(StateStores.fromParameters(params) instanceof InMemoryStateStore);

        params.setStateStoreDirectory("  ");
        assertTrue(StateStores.fromParameters(params) instanceof InMemoryStateStore);
    }

    @Test
    void testFileStoreUnderDirectory(@TempDir Path dir) {
        Path root = dir.resolve("states");
        Parameters params = new Parameters();
        params.setStateStoreDirectory(root.toString());

        StateStore store = StateStores.fromParameters(params);

        assertTrue(store instanceof FileSystemStateStore);
        assertEquals(root, ((FileSystemStateStore) store).getRoot());
        assertTrue(Files.isDirectory(root));
        store.saveState(
                "orders", Collections.singletonMap("size", "{}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(Collections.singletonList("orders"), store.listPartitions());
    }
}
