package cn.edu.zju.daily.metricguard.core.error;

import lombok.Getter;

/** A grouped metric found more groups than it may report. */
@Getter
public class TooManyGroupsException extends MetricGuardException {

    private final int totalGroups;
    private final int maxGroups;

    public TooManyGroupsException(int totalGroups, int maxGroups) {
        super("Found " + totalGroups + " groups, more than the limit of " + maxGroups);
        this.totalGroups = totalGroups;
        this.maxGroups = maxGroups;
    }
}
