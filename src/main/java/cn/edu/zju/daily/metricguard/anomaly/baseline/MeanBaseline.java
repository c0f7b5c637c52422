package cn.edu.zju.daily.metricguard.anomaly.baseline;

import cn.edu.zju.daily.metricguard.core.error.InsufficientHistoryException;
import java.util.List;

/** Mean of the whole history. */
public class MeanBaseline implements Baseline {

    @Override
    public double compute(List<Double> history) {
        if (history.isEmpty()) {
            throw new InsufficientHistoryException(0, 1);
        }
        double sum = 0;
        for (double v : history) {
            sum += v;
        }
        return sum / history.size();
    }

    @Override
    public String describe() {
        return "mean";
    }
}
