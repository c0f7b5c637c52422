package cn.edu.zju.daily.metricguard.anomaly.baseline;

import java.util.List;

/** Reference value a current metric is compared against. */
public interface Baseline {

    /**
     * @param history values oldest first
     * @throws cn.edu.zju.daily.metricguard.core.error.InsufficientHistoryException if the history
     *     is too short
     */
    double compute(List<Double> history);

    String describe();
}
