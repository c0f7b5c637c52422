package cn.edu.zju.daily.metricguard.profiler;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class CategoricalBucket {
    private final String value;
    private final long count;

    /** Share of the non-null rows. */
    private final double percentage;
}
