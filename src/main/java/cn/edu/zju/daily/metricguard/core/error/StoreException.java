package cn.edu.zju.daily.metricguard.core.error;

/** The state store could not save, load, list or delete partition state. */
public class StoreException extends MetricGuardException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
