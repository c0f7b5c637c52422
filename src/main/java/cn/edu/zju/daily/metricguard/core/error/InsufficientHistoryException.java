package cn.edu.zju.daily.metricguard.core.error;

import lombok.Getter;

/** An anomaly detector does not have enough history to judge the current value. */
@Getter
public class InsufficientHistoryException extends MetricGuardException {

    private final int available;
    private final int required;

    public InsufficientHistoryException(int available, int required) {
        super("Insufficient history: " + available + " points, " + required + " required");
        this.available = available;
        this.required = required;
    }
}
