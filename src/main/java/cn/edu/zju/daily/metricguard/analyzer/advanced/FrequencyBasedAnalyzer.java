package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base for analyzers finalized from exact value frequencies. Rows with a null in any of the grouped
 * columns are counted in the row total but not grouped.
 */
public abstract class FrequencyBasedAnalyzer extends AbstractAnalyzer<FrequencyState> {

    protected FrequencyBasedAnalyzer(String name, List<String> columns) {
        super(name, String.join(",", columns), columns, FrequencyState.class);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException(name + " needs at least one column");
        }
    }

    @Override
    public CompletableFuture<FrequencyState> computeState(ExecutionContext context) {
        Map<String, Long> frequencies = new HashMap<>();
        long[] rows = new long[1];
        return scan(
                        context,
                        row -> {
                            rows[0]++;
                            String key = groupingKey(row);
                            if (key != null) {
                                frequencies.merge(key, 1L, Long::sum);
                            }
                        })
                .thenApply(n -> new FrequencyState(frequencies, rows[0]));
    }

    static String groupingKey(Object[] row) {
        if (row.length == 1) {
            return row[0] == null ? null : HashUtils.canonical(row[0]);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.length; i++) {
            if (row[i] == null) {
                return null;
            }
            if (i > 0) {
                sb.append(',');
            }
            sb.append(HashUtils.canonical(row[i]));
        }
        return sb.toString();
    }

    @Override
    public FrequencyState emptyState() {
        return FrequencyState.EMPTY;
    }
}
