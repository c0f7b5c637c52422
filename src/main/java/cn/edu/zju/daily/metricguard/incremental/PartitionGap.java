package cn.edu.zju.daily.metricguard.incremental;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A metric that was not computed for a partition because its columns were missing. */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class PartitionGap {
    private final String partitionKey;
    private final String metricKey;
    private final List<String> missingColumns;
}
