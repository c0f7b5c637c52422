package cn.edu.zju.daily.metricguard.sketch;

import cn.edu.zju.daily.metricguard.core.error.StateIncompatibilityException;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue;
import cn.edu.zju.daily.metricguard.core.state.AnalyzerState;
import cn.edu.zju.daily.metricguard.core.state.States;
import java.util.Arrays;
import lombok.Getter;

/** Immutable HyperLogLog registers. Merging takes the element-wise maximum. */
@Getter
public final class HyperLogLogState implements AnalyzerState<HyperLogLogState> {

    private final int precision;
    private final int seed;
    private final byte[] registers;

    public HyperLogLogState(int precision, int seed, byte[] registers) {
        HyperLogLog.checkPrecision(precision);
        if (registers.length != 1 << precision) {
            throw new IllegalArgumentException(
                    "Expected " + (1 << precision) + " registers, got " + registers.length);
        }
        this.precision = precision;
        this.seed = seed;
        this.registers = registers.clone();
    }

    public static HyperLogLogState empty(int precision, int seed) {
        return new HyperLogLogState(precision, seed, new byte[1 << precision]);
    }

    /** A copy of the registers. */
    public byte[] getRegisters() {
        return registers.clone();
    }

    public long estimate() {
        return HyperLogLog.estimate(registers);
    }

    public double relativeError() {
        return 1.04 / Math.sqrt(registers.length);
    }

    @Override
    public HyperLogLogState merge(HyperLogLogState other) {
        States.checkSameShape(this, other);
        if (precision != other.precision || seed != other.seed) {
            throw new StateIncompatibilityException(
                    String.format(
                            "HyperLogLog (precision=%d, seed=%d) vs (precision=%d, seed=%d)",
                            precision, seed, other.precision, other.seed));
        }
        byte[] merged = new byte[registers.length];
        for (int i = 0; i < merged.length; i++) {
            merged[i] = (byte) Math.max(registers[i], other.registers[i]);
        }
        return new HyperLogLogState(precision, seed, merged);
    }

    @Override
    public MetricValue toMetric() {
        return MetricValue.of(estimate());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HyperLogLogState)) {
            return false;
        }
        HyperLogLogState that = (HyperLogLogState) o;
        return precision == that.precision
                && seed == that.seed
                && Arrays.equals(registers, that.registers);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * precision + seed) + Arrays.hashCode(registers);
    }

    @Override
    public String toString() {
        return "HyperLogLogState{precision="
                + precision
                + ", seed="
                + seed
                + ", estimate="
                + estimate()
                + "}";
    }
}
