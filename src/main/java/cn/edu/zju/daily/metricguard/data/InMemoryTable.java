package cn.edu.zju.daily.metricguard.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/** A named, immutable table of rows held in memory. */
@Getter
public final class InMemoryTable {

    private final String name;
    private final TableSchema schema;
    private final List<Object[]> rows;

    public InMemoryTable(String name, TableSchema schema, List<Object[]> rows) {
        this.name = name;
        this.schema = schema;
        List<Object[]> copy = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            if (row.length != schema.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.length + " values, schema has " + schema.size());
            }
            copy.add(row.clone());
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Single-column table. */
    public static InMemoryTable ofColumn(
            String name, String column, ColumnType type, List<?> values) {
        Builder builder = builder(name).column(column, type);
        for (Object v : values) {
            builder.row(v);
        }
        return builder.build();
    }

    public int numRows() {
        return rows.size();
    }

    public static class Builder {
        private final String name;
        private final TableSchema.Builder schema = TableSchema.builder();
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(String column, ColumnType type) {
            schema.column(column, type);
            return this;
        }

        public Builder row(Object... values) {
            rows.add(values);
            return this;
        }

        public InMemoryTable build() {
            return new InMemoryTable(name, schema.build(), rows);
        }
    }
}
