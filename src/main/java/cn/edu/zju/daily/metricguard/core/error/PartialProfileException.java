package cn.edu.zju.daily.metricguard.core.error;

import lombok.Getter;

/** A profiling pass of one column failed; the passes before it are still valid. */
@Getter
public class PartialProfileException extends MetricGuardException {

    private final String column;
    private final int pass;

    public PartialProfileException(String column, int pass, Throwable cause) {
        super("Pass " + pass + " failed for column " + column + ": " + cause.getMessage(), cause);
        this.column = column;
        this.pass = pass;
    }
}
