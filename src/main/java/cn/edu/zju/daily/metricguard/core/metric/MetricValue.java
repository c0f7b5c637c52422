package cn.edu.zju.daily.metricguard.core.metric;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The finalized result of an analyzer state. Values are immutable and compared structurally.
 *
 * <p>There are five kinds of values:
 *
 * <ul>
 *   <li>{@link LongValue}: counts and sizes;
 *   <li>{@link DoubleValue}: ratios, means and other scalars;
 *   <li>{@link DistributionValue}: ordered named sub-values, e.g. quantiles or histogram ratios;
 *   <li>{@link SketchValue}: an opaque, serialized sketch that can be turned back into a state;
 *   <li>{@link StringValue}: textual results such as a mode.
 * </ul>
 */
public abstract class MetricValue implements Serializable {

    public enum Kind {
        LONG,
        DOUBLE,
        DISTRIBUTION,
        SKETCH,
        STRING
    }

    private MetricValue() {}

    public abstract Kind kind();

    /** Numeric view of this value, empty for non-scalar kinds. */
    public OptionalDouble asDouble() {
        return OptionalDouble.empty();
    }

    public boolean isNumeric() {
        return asDouble().isPresent();
    }

    public static LongValue of(long value) {
        return new LongValue(value);
    }

    public static DoubleValue of(double value) {
        return new DoubleValue(value);
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    public static DistributionValue distribution(Map<String, Double> values) {
        return new DistributionValue(values);
    }

    public static SketchValue sketch(String sketchType, byte[] payload) {
        return new SketchValue(sketchType, payload);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class LongValue extends MetricValue {

        private final long value;

        private LongValue(long value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.LONG;
        }

        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class DoubleValue extends MetricValue {

        private final double value;

        private DoubleValue(double value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.DOUBLE;
        }

        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public String toString() {
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return String.format("%.0f", value);
            }
            return String.format("%.4f", value);
        }
    }

    /** Named sub-values in insertion order. */
    @EqualsAndHashCode(callSuper = false)
    public static final class DistributionValue extends MetricValue {

        private final LinkedHashMap<String, Double> values;

        private DistributionValue(Map<String, Double> values) {
            Objects.requireNonNull(values, "values");
            this.values = new LinkedHashMap<>(values);
        }

        public Map<String, Double> getValues() {
            return Collections.unmodifiableMap(values);
        }

        public OptionalDouble get(String name) {
            Double value = values.get(name);
            return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
        }

        public int size() {
            return values.size();
        }

        @Override
        public Kind kind() {
            return Kind.DISTRIBUTION;
        }

        @Override
        public String toString() {
            return "Distribution" + values;
        }
    }

    /** A serialized sketch, tagged with the state type it decodes to. */
    @EqualsAndHashCode(callSuper = false)
    public static final class SketchValue extends MetricValue {

        @Getter private final String sketchType;
        private final byte[] payload;

        private SketchValue(String sketchType, byte[] payload) {
            this.sketchType = Objects.requireNonNull(sketchType, "sketchType");
            this.payload = Objects.requireNonNull(payload, "payload").clone();
        }

        public byte[] getPayload() {
            return payload.clone();
        }

        @Override
        public Kind kind() {
            return Kind.SKETCH;
        }

        @Override
        public String toString() {
            return "Sketch(" + sketchType + ", " + payload.length + " bytes)";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class StringValue extends MetricValue {

        private final String value;

        private StringValue(String value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
