package cn.edu.zju.daily.metricguard.data;

import java.io.Serializable;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** One aggregate expression of a single-pass aggregation query. */
@Getter
@EqualsAndHashCode
public final class Aggregate implements Serializable {

    private final AggregateFunction function;
    private final String column;

    private Aggregate(AggregateFunction function, String column) {
        this.function = function;
        this.column = column;
    }

    public static Aggregate countRows() {
        return new Aggregate(AggregateFunction.COUNT_ROWS, null);
    }

    public static Aggregate of(AggregateFunction function, String column) {
        if (function == AggregateFunction.COUNT_ROWS) {
            return countRows();
        }
        if (column == null) {
            throw new IllegalArgumentException(function + " needs a column");
        }
        return new Aggregate(function, column);
    }

    @Override
    public String toString() {
        return column == null ? function.name() : function.name() + "(" + column + ")";
    }
}
