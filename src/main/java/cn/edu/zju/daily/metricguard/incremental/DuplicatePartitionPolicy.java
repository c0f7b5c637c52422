package cn.edu.zju.daily.metricguard.incremental;

/** What to do with a partition that was already merged into the series. */
public enum DuplicatePartitionPolicy {
    /** Fail with an {@link IllegalStateException}. */
    REJECT,
    /** Leave the series untouched and report the partition as skipped. */
    SKIP
}
