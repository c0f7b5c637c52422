package cn.edu.zju.daily.metricguard.analyzer.advanced;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import java.util.Collections;

/** Shannon entropy (natural log) of a column's value distribution. */
public class EntropyAnalyzer extends FrequencyBasedAnalyzer {

    public static final String NAME = "entropy";

    public EntropyAnalyzer(String column) {
        super(NAME, Collections.singletonList(column));
    }

    @Override
    public MetricValue computeMetric(FrequencyState state) {
        return MetricValue.of(state.entropy());
    }
}
