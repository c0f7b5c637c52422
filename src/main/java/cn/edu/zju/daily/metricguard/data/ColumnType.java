package cn.edu.zju.daily.metricguard.data;

/** Physical column types understood by the query engines. */
public enum ColumnType {
    LONG,
    DOUBLE,
    STRING,
    BOOLEAN,
    DATE,
    TIMESTAMP;

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }
}
