package cn.edu.zju.daily.metricguard.anomaly.baseline;

import cn.edu.zju.daily.metricguard.core.error.InsufficientHistoryException;
import cn.edu.zju.daily.metricguard.utils.RollingWindow;
import java.util.List;

/** Mean of the last {@code window} values; a window of one compares against the previous value. */
public class WindowedBaseline implements Baseline {

    private final int window;

    public WindowedBaseline(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Window must be positive, got " + window);
        }
        this.window = window;
    }

    @Override
    public double compute(List<Double> history) {
        if (history.isEmpty()) {
            throw new InsufficientHistoryException(0, 1);
        }
        RollingWindow rolling = new RollingWindow(window);
        for (double v : history) {
            rolling.append(v);
        }
        return rolling.mean();
    }

    @Override
    public String describe() {
        return "mean of last " + window;
    }
}
