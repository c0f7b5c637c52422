package cn.edu.zju.daily.metricguard.core.error;

/**
 * The query engine failed to answer a request: unknown table or column, a malformed request or a
 * failure inside the engine itself.
 */
public class DataAccessException extends MetricGuardException {

    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
