package cn.edu.zju.daily.metricguard.core.error;

import lombok.Getter;

/** An analyzer failed while the runner was configured to stop on the first error. */
@Getter
public class AnalysisAbortedException extends MetricGuardException {

    private final String analyzerName;

    public AnalysisAbortedException(String analyzerName, Throwable cause) {
        super("Analyzer " + analyzerName + " failed: " + cause.getMessage(), cause);
        this.analyzerName = analyzerName;
    }
}
