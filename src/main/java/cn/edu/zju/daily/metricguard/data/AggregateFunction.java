package cn.edu.zju.daily.metricguard.data;

public enum AggregateFunction {
    /** Number of rows; takes no column. */
    COUNT_ROWS,
    COUNT_NON_NULL,
    COUNT_DISTINCT,
    SUM,
    MIN,
    MAX
}
