package cn.edu.zju.daily.metricguard.core.error;

/** Base class of all failures raised by the analytics engine. */
public class MetricGuardException extends RuntimeException {

    public MetricGuardException(String message) {
        super(message);
    }

    public MetricGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
