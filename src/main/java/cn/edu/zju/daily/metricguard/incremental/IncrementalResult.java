package cn.edu.zju.daily.metricguard.incremental;

import cn.edu.zju.daily.metricguard.runner.AnalysisError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Outcome of merging one partition into a series. */
@Getter
@ToString
public final class IncrementalResult {

    public enum Status {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    private final String partitionKey;
    private final Status status;

    /** Metric keys whose state this partition contributed to. */
    private final List<String> mergedMetrics;

    private final List<PartitionGap> gaps;

    /** Metric keys whose cumulative state does not cover every processed partition. */
    private final List<String> partialHistory;

    private final List<AnalysisError> errors;
    private final String failure;

    IncrementalResult(
            String partitionKey,
            Status status,
            List<String> mergedMetrics,
            List<PartitionGap> gaps,
            List<String> partialHistory,
            List<AnalysisError> errors,
            String failure) {
        this.partitionKey = partitionKey;
        this.status = status;
        this.mergedMetrics = Collections.unmodifiableList(new ArrayList<>(mergedMetrics));
        this.gaps = Collections.unmodifiableList(new ArrayList<>(gaps));
        this.partialHistory = Collections.unmodifiableList(new ArrayList<>(partialHistory));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.failure = failure;
    }

    static IncrementalResult skipped(String partitionKey) {
        return new IncrementalResult(
                partitionKey,
                Status.SKIPPED,
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.emptyList(),
                null);
    }

    static IncrementalResult failed(String partitionKey, Throwable cause) {
        return new IncrementalResult(
                partitionKey,
                Status.FAILED,
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.emptyList(),
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty() || status == Status.FAILED;
    }
}
