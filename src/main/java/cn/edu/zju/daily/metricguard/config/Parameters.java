package cn.edu.zju.daily.metricguard.config;

import cn.edu.zju.daily.metricguard.core.error.MetricGuardException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Engine parameters, read from YAML. Unset keys keep the defaults below. */
@Slf4j
@Data
@NoArgsConstructor
public class Parameters implements Serializable {

    public static final String DEFAULT_RESOURCE = "metricguard-default.yaml";

    public static Parameters load(String path, boolean isResource) {
        Yaml yaml = new Yaml(new Constructor(Parameters.class, new LoaderOptions()));
        if (isResource) {
            String url = path.startsWith("/") ? path : "/" + path;
            LOG.info("Reading params from resource {}", url);
            try (InputStream in = Parameters.class.getResourceAsStream(url)) {
                if (in == null) {
                    throw new MetricGuardException("Resource not found: " + url);
                }
                return orDefaults(yaml.load(in));
            } catch (IOException e) {
                throw new MetricGuardException("Cannot read parameters from " + url, e);
            }
        } else {
            LOG.info("Reading params from file {}", path);
            try (InputStream in = Files.newInputStream(Paths.get(path))) {
                return orDefaults(yaml.load(in));
            } catch (IOException e) {
                throw new MetricGuardException("Cannot read parameters from " + path, e);
            }
        }
    }

    public static Parameters loadDefault() {
        return load(DEFAULT_RESOURCE, true);
    }

    private static Parameters orDefaults(Parameters loaded) {
        // an empty document loads as null
        return loaded == null ? new Parameters() : loaded;
    }

    // ======================
    // Analysis
    // ======================
    private boolean continueOnError = true;

    // ======================
    // Sketches
    // ======================
    private int hllPrecision = 12;
    private int kllK = 200;
    private long randomSeed = 0L;

    // ======================
    // Profiler
    // ======================
    /** Rows read for type inference in the first pass. */
    private int profilerSampleSize = 10000;

    /** Columns with at most this many estimated distinct values get exact distinct counts. */
    private long exactCardinalityThreshold = 10000;

    private long categoricalCeiling = 100;
    private int histogramTopN = 20;
    private int patternSampleSize = 1000;
    private double typeConfidenceThreshold = 0.7;
    private List<Number> quantiles;
    private double outlierIqrMultiplier = 1.5;
    private int maxSampleValues = 10;

    // ======================
    // Incremental
    // ======================
    /** Directory of the file state store; the in-memory store is used when unset. */
    private String stateStoreDirectory;

    /** REJECT or SKIP. */
    private String duplicatePartitionPolicy = "REJECT";

    private boolean recordPartitionDeltas = true;
    private int maxConcurrency = 1;

    // ======================
    // Anomaly detection
    // ======================
    private double minConfidence = 0.5;
    private int historyWindowDays = 30;
    private int historyLimit = 100;
    private boolean storeCurrentMetrics = true;
    private int repositoryCapacity = 1000;
}
