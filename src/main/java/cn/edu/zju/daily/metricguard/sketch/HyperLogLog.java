package cn.edu.zju.daily.metricguard.sketch;

import cn.edu.zju.daily.metricguard.utils.HashUtils;

/**
 * Mutable HyperLogLog counter. Values are hashed to 32 bits; the first {@code precision} bits
 * select a register and the register keeps the largest position of the leftmost 1 seen in the
 * remaining bits.
 *
 * <p>Relative standard error is about {@code 1.04 / sqrt(2^precision)}.
 */
public class HyperLogLog {

    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 18;
    public static final int DEFAULT_PRECISION = 12;
    public static final int DEFAULT_SEED = 0;

    private static final double TWO_POW_32 = 4294967296d;

    private final int precision;
    private final int seed;
    private final byte[] registers;

    public HyperLogLog() {
        this(DEFAULT_PRECISION, DEFAULT_SEED);
    }

    public HyperLogLog(int precision, int seed) {
        checkPrecision(precision);
        this.precision = precision;
        this.seed = seed;
        this.registers = new byte[1 << precision];
    }

    public static HyperLogLog fromState(HyperLogLogState state) {
        HyperLogLog hll = new HyperLogLog(state.getPrecision(), state.getSeed());
        System.arraycopy(state.getRegisters(), 0, hll.registers, 0, hll.registers.length);
        return hll;
    }

    static void checkPrecision(int precision) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                    "Precision must be in ["
                            + MIN_PRECISION
                            + ", "
                            + MAX_PRECISION
                            + "], got "
                            + precision);
        }
    }

    /** Null values are not counted. */
    public void add(Object value) {
        if (value == null) {
            return;
        }
        addHash(HashUtils.hash32(value, seed));
    }

    void addHash(int hash) {
        int index = hash >>> (32 - precision);
        int rest = hash << precision;
        int maxRank = 32 - precision + 1;
        int rank = rest == 0 ? maxRank : Math.min(Integer.numberOfLeadingZeros(rest) + 1, maxRank);
        if (rank > registers[index]) {
            registers[index] = (byte) rank;
        }
    }

    public long estimate() {
        return estimate(registers);
    }

    public HyperLogLogState snapshot() {
        return new HyperLogLogState(precision, seed, registers);
    }

    public int getPrecision() {
        return precision;
    }

    public int getSeed() {
        return seed;
    }

    static long estimate(byte[] registers) {
        int m = registers.length;
        double sum = 0;
        int zeros = 0;
        for (byte r : registers) {
            sum += Math.scalb(1d, -r);
            if (r == 0) {
                zeros++;
            }
        }
        double raw = alpha(m) * m * m / sum;
        double estimate;
        if (raw <= 2.5 * m && zeros > 0) {
            // small range: linear counting
            estimate = m * Math.log((double) m / zeros);
        } else if (raw > TWO_POW_32 / 30) {
            estimate = -TWO_POW_32 * Math.log(1 - raw / TWO_POW_32);
        } else {
            estimate = raw;
        }
        return Math.round(estimate);
    }

    private static double alpha(int m) {
        switch (m) {
            case 16:
                return 0.673;
            case 32:
                return 0.697;
            case 64:
                return 0.709;
            default:
                return 0.7213 / (1 + 1.079 / m);
        }
    }
}
