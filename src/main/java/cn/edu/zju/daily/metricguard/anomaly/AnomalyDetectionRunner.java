package cn.edu.zju.daily.metricguard.anomaly;

import cn.edu.zju.daily.metricguard.anomaly.detector.AnomalyDetector;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.runner.AnalyzerContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares freshly computed metrics with their history. Every detector whose pattern matches a
 * metric runs, and the report holds the union of their findings above the minimum confidence.
 * History is read before the current values are stored, so a value is never compared with itself.
 */
@Slf4j
public class AnomalyDetectionRunner {

    private final MetricsRepository repository;
    private final DetectorRegistry registry;
    private final AnomalyDetectionConfig config;
    private final Clock clock;

    private AnomalyDetectionRunner(Builder builder) {
        this.repository = builder.repository;
        this.registry = builder.registry;
        this.config = builder.config;
        this.clock = builder.clock;
    }

    public static Builder builder(MetricsRepository repository) {
        return new Builder(repository);
    }

    public AnomalyReport detect(AnalyzerContext context) {
        return detect(context.getMetrics(), Collections.emptyMap());
    }

    public AnomalyReport detect(Map<String, MetricValue> metrics, Map<String, String> tags) {
        Instant now = clock.instant();
        Instant since = now.minus(config.getHistoryWindow());
        List<Anomaly> anomalies = new ArrayList<>();
        List<AnomalyReport.Abstention> abstentions = new ArrayList<>();
        List<AnomalyReport.DetectorError> errors = new ArrayList<>();

        for (Map.Entry<String, MetricValue> entry : metrics.entrySet()) {
            String metric = entry.getKey();
            OptionalDouble value = entry.getValue().asDouble();
            if (!value.isPresent()) {
                LOG.debug("Skipping non-numeric metric {}", metric);
                continue;
            }
            double current = value.getAsDouble();
            List<AnomalyDetector> detectors = registry.detectorsFor(metric);
            if (!detectors.isEmpty()) {
                List<MetricPoint> history = recent(repository.getHistory(metric, since, now));
                for (AnomalyDetector detector : detectors) {
                    try {
                        DetectionResult result = detector.detect(metric, history, current);
                        switch (result.getStatus()) {
                            case ANOMALY:
                                Anomaly anomaly = result.getAnomaly().get();
                                if (anomaly.getConfidence() >= config.getMinConfidence()) {
                                    LOG.info(
                                            "Anomaly in {} by {}: {}",
                                            metric,
                                            detector.name(),
                                            anomaly.getDescription());
                                    anomalies.add(anomaly);
                                } else {
                                    LOG.debug(
                                            "Dropped {} finding on {} with confidence {}",
                                            detector.name(),
                                            metric,
                                            anomaly.getConfidence());
                                }
                                break;
                            case INSUFFICIENT_DATA:
                                abstentions.add(
                                        new AnomalyReport.Abstention(
                                                metric, detector.name(), result.getReason()));
                                break;
                            default:
                                break;
                        }
                    } catch (RuntimeException e) {
                        LOG.warn("Detector {} failed on {}", detector.name(), metric, e);
                        errors.add(
                                new AnomalyReport.DetectorError(
                                        metric,
                                        detector.name(),
                                        e.getClass().getSimpleName(),
                                        String.valueOf(e.getMessage())));
                    }
                }
            }
            if (config.isStoreCurrentMetrics()) {
                repository.store(metric, current, now, tags);
            }
        }
        LOG.info(
                "Checked {} metrics: {} anomalies, {} abstentions, {} errors",
                metrics.size(),
                anomalies.size(),
                abstentions.size(),
                errors.size());
        return new AnomalyReport(anomalies, abstentions, errors);
    }

    private List<MetricPoint> recent(List<MetricPoint> history) {
        int limit = config.getHistoryLimit();
        if (limit <= 0 || history.size() <= limit) {
            return history;
        }
        return new ArrayList<>(history.subList(history.size() - limit, history.size()));
    }

    public DetectorRegistry getRegistry() {
        return registry;
    }

    public static class Builder {
        private final MetricsRepository repository;
        private final DetectorRegistry registry = new DetectorRegistry();
        private AnomalyDetectionConfig config = new AnomalyDetectionConfig();
        private Clock clock = Clock.systemUTC();

        private Builder(MetricsRepository repository) {
            this.repository = repository;
        }

        public Builder addDetector(String pattern, AnomalyDetector detector) {
            registry.register(pattern, detector);
            return this;
        }

        public Builder config(AnomalyDetectionConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AnomalyDetectionRunner build() {
            if (repository == null) {
                throw new IllegalStateException("A metrics repository is required");
            }
            return new AnomalyDetectionRunner(this);
        }
    }
}
