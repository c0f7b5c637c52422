package cn.edu.zju.daily.metricguard.anomaly;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A metric value outside the range its detector expected. */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class Anomaly {
    private final String metricName;
    private final String detector;
    private final double currentValue;
    private final double expectedValue;
    private final double lowerBound;
    private final double upperBound;
    private final Severity severity;

    /** In {@code [0, 1]}. */
    private final double confidence;

    private final String description;
}
