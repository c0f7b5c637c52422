package cn.edu.zju.daily.metricguard.profiler;

/** Semantic type of a column as seen by the profiler. */
public enum DetectedDataType {
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    STRING,
    /** A string or boolean column with few distinct values. */
    CATEGORICAL,
    /** No single type reaches the confidence threshold. */
    MIXED,
    /** Only nulls were seen. */
    UNKNOWN;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }
}
