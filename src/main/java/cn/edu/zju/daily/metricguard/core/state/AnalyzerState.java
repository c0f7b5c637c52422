package cn.edu.zju.daily.metricguard.core.state;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import java.io.Serializable;

/**
 * An intermediate, mergeable summary of data from which one metric is finalized.
 *
 * <p>Implementations are immutable. {@link #merge} returns a new state and must be associative and
 * commutative, so partitions can be combined in any order. Merging with the state's empty value
 * returns an equal state. Merging states of different shapes throws {@link
 * cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException}.
 *
 * @param <S> the concrete state type
 */
public interface AnalyzerState<S extends AnalyzerState<S>> extends Serializable {

    S merge(S other);

    MetricValue toMetric();
}
