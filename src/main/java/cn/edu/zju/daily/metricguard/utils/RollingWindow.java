package cn.edu.zju.daily.metricguard.utils;

/** Running mean of the last {@code size} appended values. */
public class RollingWindow {
    private final double[] values;
    private int index = 0;
    private boolean full = false;
    private double sum = 0d;

    public RollingWindow(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got " + size);
        }
        this.values = new double[size];
    }

    public void append(double value) {
        sum += value - values[index];
        values[index] = value;
        index = (index + 1) % values.length;
        if (index == 0) {
            full = true;
        }
    }

    public int count() {
        return full ? values.length : index;
    }

    /** NaN while empty. */
    public double mean() {
        int count = count();
        return count == 0 ? Double.NaN : sum / count;
    }
}
