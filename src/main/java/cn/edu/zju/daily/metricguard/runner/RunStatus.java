package cn.edu.zju.daily.metricguard.runner;

public enum RunStatus {
    SUCCESS,
    COMPLETED_WITH_ERRORS,
    /** Stopped early; metrics computed before the stop are still valid. */
    CANCELLED
}
