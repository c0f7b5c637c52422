package cn.edu.zju.daily.metricguard.analyzer.grouped;

/** Which groups to report when there are more than {@link GroupingConfig#getMaxGroups()}. */
public enum OverflowStrategy {
    /** Groups with the highest metric values. */
    TOP_K,
    /** Groups with the lowest metric values. */
    BOTTOM_K,
    /** A pseudo-random subset chosen by hashing group keys, stable across runs. */
    SAMPLE,
    /** Report nothing and throw {@code TooManyGroupsException}. */
    FAIL
}
