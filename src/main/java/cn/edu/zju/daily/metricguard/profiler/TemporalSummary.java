package cn.edu.zju.daily.metricguard.profiler;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Range of a date or timestamp column, in ISO-8601. {@code formatConsistency} is the share of
 * values written in the dominant format; typed temporal columns are fully consistent.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class TemporalSummary {
    private final String earliest;
    private final String latest;
    private final long spanDays;
    private final String format;
    private final double formatConsistency;
    private final long unparseable;
}
