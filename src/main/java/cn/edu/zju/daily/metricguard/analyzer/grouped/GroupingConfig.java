package cn.edu.zju.daily.metricguard.analyzer.grouped;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/** Columns to group by and how many groups to report. */
@Getter
@ToString
@EqualsAndHashCode
public final class GroupingConfig {

    public static final int DEFAULT_MAX_GROUPS = 10000;

    private final List<String> columns;
    private final int maxGroups;
    private final boolean includeOverall;
    private final OverflowStrategy overflowStrategy;

    public GroupingConfig(List<String> columns) {
        this(columns, DEFAULT_MAX_GROUPS, true, OverflowStrategy.TOP_K);
    }

    private GroupingConfig(
            List<String> columns,
            int maxGroups,
            boolean includeOverall,
            OverflowStrategy overflowStrategy) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Grouping needs at least one column");
        }
        for (String column : columns) {
            if (StringUtils.isBlank(column)) {
                throw new IllegalArgumentException("Column name must not be blank");
            }
        }
        if (maxGroups <= 0) {
            throw new IllegalArgumentException("maxGroups must be positive");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.maxGroups = maxGroups;
        this.includeOverall = includeOverall;
        this.overflowStrategy = overflowStrategy;
    }

    public static GroupingConfig of(String... columns) {
        return new GroupingConfig(Arrays.asList(columns));
    }

    public GroupingConfig withMaxGroups(int maxGroups) {
        return new GroupingConfig(columns, maxGroups, includeOverall, overflowStrategy);
    }

    public GroupingConfig withOverall(boolean includeOverall) {
        return new GroupingConfig(columns, maxGroups, includeOverall, overflowStrategy);
    }

    public GroupingConfig withOverflowStrategy(OverflowStrategy overflowStrategy) {
        return new GroupingConfig(columns, maxGroups, includeOverall, overflowStrategy);
    }
}
