package cn.edu.zju.daily.metricguard.anomaly;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Verdict of one detector on one metric value. */
@Getter
@ToString
@EqualsAndHashCode
public final class DetectionResult {

    public enum Status {
        NORMAL,
        ANOMALY,
        /** The detector abstained, for example for lack of history. */
        INSUFFICIENT_DATA
    }

    private static final DetectionResult NORMAL = new DetectionResult(Status.NORMAL, null, null);

    private final Status status;
    private final Anomaly anomaly;
    private final String reason;

    private DetectionResult(Status status, Anomaly anomaly, String reason) {
        this.status = status;
        this.anomaly = anomaly;
        this.reason = reason;
    }

    public static DetectionResult normal() {
        return NORMAL;
    }

    public static DetectionResult anomaly(Anomaly anomaly) {
        return new DetectionResult(Status.ANOMALY, anomaly, anomaly.getDescription());
    }

    public static DetectionResult insufficientData(String reason) {
        return new DetectionResult(Status.INSUFFICIENT_DATA, null, reason);
    }

    public Optional<Anomaly> getAnomaly() {
        return Optional.ofNullable(anomaly);
    }

    public boolean isAnomaly() {
        return status == Status.ANOMALY;
    }
}
