package cn.edu.zju.daily.metricguard.anomaly;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    /**
     * Severity of a finding that is {@code ratio} times its detector's threshold: below 1.25 is
     * {@link #INFO}, below 2 is {@link #WARNING}.
     */
    public static Severity fromRatio(double ratio) {
        if (ratio < 1.25) {
            return INFO;
        }
        if (ratio < 2) {
            return WARNING;
        }
        return CRITICAL;
    }
}
