package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import java.util.Arrays;
import java.util.List;

/** Distinct values over non-null rows. */
public class DistinctnessAnalyzer extends FrequencyBasedAnalyzer {

    public static final String NAME = "distinctness";

    public DistinctnessAnalyzer(String... columns) {
        this(Arrays.asList(columns));
    }

    public DistinctnessAnalyzer(List<String> columns) {
        super(NAME, columns);
    }

    @Override
    public MetricValue computeMetric(FrequencyState state) {
        long rows = state.groupedRows();
        return MetricValue.of(rows == 0 ? Double.NaN : (double) state.distinctCount() / rows);
    }
}
