package cn.edu.zju.daily.metricguard.incremental;

import cn.edu.zju.daily.metricguard.config.Parameters;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class IncrementalConfig {

    private DuplicatePartitionPolicy duplicatePolicy = DuplicatePartitionPolicy.REJECT;

    /** Also store each partition's own states, so they can be audited or pruned later. */
    private boolean recordPartitionDeltas = true;

    private int maxConcurrency = 1;
    private boolean continueOnError = true;

    public static IncrementalConfig fromParameters(Parameters params) {
        IncrementalConfig config = new IncrementalConfig();
        String policy = params.getDuplicatePartitionPolicy().trim().toUpperCase();
        config.setDuplicatePolicy(DuplicatePartitionPolicy.valueOf(policy));
        config.setRecordPartitionDeltas(params.isRecordPartitionDeltas());
        config.setMaxConcurrency(params.getMaxConcurrency());
        config.setContinueOnError(params.isContinueOnError());
        return config;
    }
}
