package cn.edu.zju.daily.metricguard.data;

import cn.edu.zju.daily.metricguard.core.error.DataAccessException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Ordered column names and their types. */
@ToString
@EqualsAndHashCode
public final class TableSchema implements Serializable {

    private final Map<String, ColumnType> columns;

    public TableSchema(Map<String, ColumnType> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column);
    }

    /**
     * @throws DataAccessException if the column does not exist
     */
    public ColumnType typeOf(String column) {
        ColumnType type = columns.get(column);
        if (type == null) {
            throw new DataAccessException("Unknown column " + column);
        }
        return type;
    }

    /** Position of the column in a row. */
    public int indexOf(String column) {
        int i = 0;
        for (String name : columns.keySet()) {
            if (name.equals(column)) {
                return i;
            }
            i++;
        }
        throw new DataAccessException("Unknown column " + column);
    }

    public int size() {
        return columns.size();
    }

    public static class Builder {
        private final Map<String, ColumnType> columns = new LinkedHashMap<>();

        public Builder column(String name, ColumnType type) {
            if (columns.put(name, type) != null) {
                throw new IllegalArgumentException("Duplicate column " + name);
            }
            return this;
        }

        public TableSchema build() {
            return new TableSchema(columns);
        }
    }
}
