package cn.edu.zju.daily.metricguard.profiler;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A column whose profiling failed in the given pass. */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ColumnProfileError {
    private final String column;
    private final int pass;
    private final String errorType;
    private final String message;

    public static ColumnProfileError of(String column, int pass, Throwable cause) {
        return new ColumnProfileError(
                column, pass, cause.getClass().getSimpleName(), String.valueOf(cause.getMessage()));
    }
}
