package cn.edu.zju.daily.metricguard.core;

import cn.edu.zju.daily.metricguard.data.QueryEngine;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/** The engine and table an analysis runs against. */
@Getter
@ToString
@AllArgsConstructor
public final class ExecutionContext {

    @NonNull private final QueryEngine engine;
    @NonNull private final String table;

    public ExecutionContext withTable(String otherTable) {
        return new ExecutionContext(engine, otherTable);
    }
}
