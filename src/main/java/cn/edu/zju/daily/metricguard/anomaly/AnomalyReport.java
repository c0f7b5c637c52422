package cn.edu.zju.daily.metricguard.anomaly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Findings of one detection pass. */
@Getter
@ToString
public final class AnomalyReport {

    /** A detector that declined to judge a metric. */
    @Getter
    @ToString
    @EqualsAndHashCode
    @AllArgsConstructor
    public static final class Abstention {
        private final String metricName;
        private final String detector;
        private final String reason;
    }

    /** A detector that threw while judging a metric. */
    @Getter
    @ToString
    @EqualsAndHashCode
    @AllArgsConstructor
    public static final class DetectorError {
        private final String metricName;
        private final String detector;
        private final String errorType;
        private final String message;
    }

    private final List<Anomaly> anomalies;
    private final List<Abstention> abstentions;
    private final List<DetectorError> errors;

    public AnomalyReport(
            List<Anomaly> anomalies, List<Abstention> abstentions, List<DetectorError> errors) {
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
        this.abstentions = Collections.unmodifiableList(new ArrayList<>(abstentions));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<Anomaly> getAnomalies(String metricName) {
        return anomalies.stream()
                .filter(a -> a.getMetricName().equals(metricName))
                .collect(Collectors.toList());
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
