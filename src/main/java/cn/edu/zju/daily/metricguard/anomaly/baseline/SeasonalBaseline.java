package cn.edu.zju.daily.metricguard.anomaly.baseline;

import cn.edu.zju.daily.metricguard.core.error.InsufficientHistoryException;
import java.util.List;

/**
 * Mean of the values one, two, ... periods before the current one. With daily points and a period
 * of 7 a Monday is compared with earlier Mondays.
 */
public class SeasonalBaseline implements Baseline {

    private final int period;

    public SeasonalBaseline(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive, got " + period);
        }
        this.period = period;
    }

    @Override
    public double compute(List<Double> history) {
        // the current value would sit at index history.size()
        double sum = 0;
        int count = 0;
        for (int i = history.size() - period; i >= 0; i -= period) {
            sum += history.get(i);
            count++;
        }
        if (count == 0) {
            throw new InsufficientHistoryException(history.size(), period);
        }
        return sum / count;
    }

    @Override
    public String describe() {
        return "seasonal mean, period " + period;
    }
}
