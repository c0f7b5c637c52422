package cn.edu.zju.daily.metricguard.analyzer.grouped;

import cn.edu.zju.daily.metricguard.analyzer.AbstractAnalyzer;
import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.TooManyGroupsException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import cn.edu.zju.daily.metricguard.core.state.GroupedState;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes an inner state separately for each distinct combination of the grouping columns. The
 * state keeps every group; {@link GroupingConfig#getMaxGroups()} and the overflow strategy only
 * decide which groups are reported.
 *
 * <p>Group keys are the canonical values of the grouping columns joined with {@code ','}. A null
 * grouping value is keyed as {@link FrequencyState#NULL_KEY}.
 *
 * @param <S> the per-group state
 */
@Slf4j
public abstract class GroupedAnalyzer<S extends AnalyzerState<S>>
        extends AbstractAnalyzer<GroupedState<S>> {

    private static final int SAMPLE_SEED = 42;

    private final GroupingConfig grouping;
    private final int valueColumns;

    protected GroupedAnalyzer(String name, List<String> valueColumns, GroupingConfig grouping) {
        super(
                name,
                String.join(",", valueColumns) + "_by_" + String.join(",", grouping.getColumns()),
                scanColumns(grouping, valueColumns),
                GroupedAnalyzer.<S>groupedStateClass());
        this.grouping = grouping;
        this.valueColumns = valueColumns.size();
    }

    private static List<String> scanColumns(GroupingConfig grouping, List<String> valueColumns) {
        List<String> columns = new ArrayList<>(grouping.getColumns());
        columns.addAll(valueColumns);
        return columns;
    }

    @SuppressWarnings("unchecked")
    private static <S extends AnalyzerState<S>> Class<GroupedState<S>> groupedStateClass() {
        return (Class<GroupedState<S>>) (Class<?>) GroupedState.class;
    }

    public GroupingConfig getGrouping() {
        return grouping;
    }

    /** Identity of the per-group state. */
    protected abstract S emptyGroupState();

    /** State of a single row, given the values of the value columns in order. */
    protected abstract S rowState(Object[] values);

    @Override
    public CompletableFuture<GroupedState<S>> computeState(ExecutionContext context) {
        Map<String, S> groups = new HashMap<>();
        int keyColumns = grouping.getColumns().size();
        return scan(
                        context,
                        row -> {
                            String key = groupKey(row, keyColumns);
                            S state = rowState(Arrays.copyOfRange(row, keyColumns, row.length));
                            S current = groups.get(key);
                            groups.put(key, current == null ? state : current.merge(state));
                        })
                .thenApply(
                        n -> {
                            LOG.debug("{} found {} groups in {} rows", this, groups.size(), n);
                            return new GroupedState<>(groups);
                        });
    }

    static String groupKey(Object[] row, int keyColumns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < keyColumns; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(row[i] == null ? FrequencyState.NULL_KEY : HashUtils.canonical(row[i]));
        }
        return sb.toString();
    }

    @Override
    public GroupedState<S> emptyState() {
        return GroupedState.empty();
    }

    /** Metric of one group. Defaults to the state's own metric. */
    protected MetricValue groupMetric(S state) {
        return state.toMetric();
    }

    /**
     * Finalizes the reported groups in key order.
     *
     * @throws TooManyGroupsException if there are more groups than allowed and the strategy is
     *     {@link OverflowStrategy#FAIL}
     */
    public GroupedMetrics computeGroupedMetrics(GroupedState<S> state) {
        int total = state.groupCount();
        Map<String, MetricValue> metrics = new HashMap<>();
        for (Map.Entry<String, S> e : state.getGroups().entrySet()) {
            metrics.put(e.getKey(), groupMetric(e.getValue()));
        }
        Map<String, MetricValue> reported = new TreeMap<>();
        for (String key : select(metrics, total)) {
            reported.put(key, metrics.get(key));
        }
        MetricValue overall =
                grouping.isIncludeOverall() ? groupMetric(state.overall(emptyGroupState())) : null;
        return new GroupedMetrics(grouping.getColumns(), reported, overall, total);
    }

    private List<String> select(Map<String, MetricValue> metrics, int total) {
        List<String> keys = new ArrayList<>(metrics.keySet());
        int max = grouping.getMaxGroups();
        if (total <= max) {
            return keys;
        }
        Comparator<String> order;
        switch (grouping.getOverflowStrategy()) {
            case TOP_K:
                // NaN sorts last in both directions
                order = Comparator.comparingDouble((String k) -> -sortValue(metrics.get(k)));
                break;
            case BOTTOM_K:
                order = Comparator.comparingDouble((String k) -> sortValue(metrics.get(k)));
                break;
            case SAMPLE:
                order = Comparator.comparingInt((String k) -> HashUtils.hash32(k, SAMPLE_SEED));
                break;
            case FAIL:
                throw new TooManyGroupsException(total, max);
            default:
                throw new IllegalStateException(
                        "Unknown overflow strategy " + grouping.getOverflowStrategy());
        }
        keys.sort(order.thenComparing(Comparator.naturalOrder()));
        LOG.info(
                "{} reports {} of {} groups ({})",
                this,
                max,
                total,
                grouping.getOverflowStrategy());
        return keys.subList(0, max);
    }

    private static double sortValue(MetricValue value) {
        return value.asDouble().orElse(Double.NaN);
    }

    /** Reported groups as a distribution, plus the overall metric when requested. */
    @Override
    public MetricValue computeMetric(GroupedState<S> state) {
        return computeGroupedMetrics(state).toMetricValue();
    }
}
