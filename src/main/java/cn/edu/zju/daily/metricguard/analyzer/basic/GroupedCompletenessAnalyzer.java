package cn.edu.zju.daily.metricguard.analyzer.basic;

import cn.edu.zju.daily.metricguard.analyzer.grouped.GroupedAnalyzer;
import cn.edu.zju.daily.metricguard.analyzer.grouped.GroupingConfig;
import cn.edu.zju.daily.metricguard.core.state.RatioState;
import java.util.Collections;

/** Fraction of non-null values of a column within each group. */
public class GroupedCompletenessAnalyzer extends GroupedAnalyzer<RatioState> {

    public static final String NAME = "grouped_completeness";

    private static final RatioState PRESENT = new RatioState(1, 1);
    private static final RatioState MISSING = new RatioState(0, 1);

    public GroupedCompletenessAnalyzer(String column, GroupingConfig grouping) {
        super(NAME, Collections.singletonList(column), grouping);
    }

    @Override
    protected RatioState emptyGroupState() {
        return RatioState.EMPTY;
    }

    @Override
    protected RatioState rowState(Object[] values) {
        return values[0] == null ? MISSING : PRESENT;
    }
}
