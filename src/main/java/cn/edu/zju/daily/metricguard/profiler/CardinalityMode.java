package cn.edu.zju.daily.metricguard.profiler;

/** How distinct counts are computed after the first pass. */
public enum CardinalityMode {
    /** Hash-set based, used for low-cardinality columns. */
    EXACT,
    /** Taken from the HyperLogLog estimate of the first pass. */
    APPROXIMATE
}
