package cn.edu.zju.daily.metricguard.incremental;

import cn.edu.zju.daily.metricguard.core.error.StoreException;
import java.io.IOException;
import java.io.Writer;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Stores each entry as {@code <root>/<url-encoded key>/state.json}. Writes go to a temporary file
 * that is then atomically moved over the previous version, so readers see either the old or the
 * new entry.
 */
@Slf4j
public class FileSystemStateStore implements StateStore {

    static final String STATE_FILE = "state.json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileSystemStateStore(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StoreException("Cannot create state directory " + root, e);
        }
    }

    @Override
    public void saveState(String key, Map<String, byte[]> states) {
        Path dir = directoryOf(key);
        JSONObject entries = new JSONObject();
        Base64.Encoder encoder = Base64.getEncoder();
        states.forEach((k, v) -> entries.put(k, encoder.encodeToString(v)));
        JSONObject json = new JSONObject().put("key", key).put("states", entries);
        try {
            Files.createDirectories(dir);
            Path target = dir.resolve(STATE_FILE);
            Path temp = dir.resolve(STATE_FILE + TEMP_SUFFIX);
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(json.toString());
            }
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreException("Cannot save state " + key, e);
        }
        LOG.debug("Saved {} states under {}", states.size(), key);
    }

    @Override
    public Optional<Map<String, byte[]>> loadState(String key) {
        Path file = directoryOf(key).resolve(STATE_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            JSONObject entries = json.getJSONObject("states");
            Map<String, byte[]> states = new LinkedHashMap<>();
            Base64.Decoder decoder = Base64.getDecoder();
            for (String k : entries.keySet()) {
                states.put(k, decoder.decode(entries.getString(k)));
            }
            return Optional.of(states);
        } catch (IOException e) {
            throw new StoreException("Cannot load state " + key, e);
        } catch (JSONException | IllegalArgumentException e) {
            throw new StoreException("Corrupt state file " + file, e);
        }
    }

    @Override
    public List<String> listPartitions() {
        List<String> keys = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                if (Files.exists(dir.resolve(STATE_FILE))) {
                    String name = dir.getFileName().toString();
                    keys.add(URLDecoder.decode(name, StandardCharsets.UTF_8));
                }
            }
        } catch (IOException e) {
            throw new StoreException("Cannot list " + root, e);
        }
        Collections.sort(keys);
        return keys;
    }

    @Override
    public void deleteState(String key) {
        Path dir = directoryOf(key);
        try {
            Files.deleteIfExists(dir.resolve(STATE_FILE + TEMP_SUFFIX));
            Files.deleteIfExists(dir.resolve(STATE_FILE));
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            throw new StoreException("Cannot delete state " + key, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path directoryOf(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("State key must not be empty");
        }
        String name = URLEncoder.encode(key, StandardCharsets.UTF_8);
        if (name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Invalid state key " + key);
        }
        return root.resolve(name);
    }
}
