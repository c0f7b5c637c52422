package cn.edu.zju.daily.metricguard.runner;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Failure of one analyzer, with enough context to rerun just that analyzer. */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class AnalysisError {

    private final String metricKey;
    private final String analyzerName;
    private final List<String> columns;
    private final String errorType;
    private final String message;

    public static AnalysisError of(AnalyzerExecution execution, Throwable cause) {
        return new AnalysisError(
                execution.metricKey(),
                execution.name(),
                execution.columns(),
                cause.getClass().getSimpleName(),
                String.valueOf(cause.getMessage()));
    }
}
