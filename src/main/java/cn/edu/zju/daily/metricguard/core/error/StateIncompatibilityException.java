package cn.edu.zju.daily.metricguard.core.error;

/**
 * Two analyzer states of different shapes (or of the same shape but built with different sketch
 * parameters) were merged. This is a programming error and is never recovered from.
 */
public class StateIncompatibilityException extends MetricGuardException {

    public StateIncompatibilityException(String message) {
        super(message);
    }

    public static StateIncompatibilityException of(Object left, Object right) {
        return new StateIncompatibilityException(
                "Cannot merge "
                        + (left == null ? "null" : left.getClass().getSimpleName())
                        + " with "
                        + (right == null ? "null" : right.getClass().getSimpleName()));
    }
}
