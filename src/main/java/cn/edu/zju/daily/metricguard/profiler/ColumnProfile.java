package cn.edu.zju.daily.metricguard.profiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable snapshot of one column. Optional sections are present depending on the detected type.
 * Profiling time is not part of equality, so profiling the same data twice gives equal profiles.
 */
@Getter
@ToString
@EqualsAndHashCode(exclude = "profilingTimeMs")
public final class ColumnProfile {

    private final String columnName;
    private final DetectedDataType dataType;
    private final TypeInference typeInference;
    private final long rowCount;
    private final long nullCount;
    private final long distinctCount;
    private final boolean distinctExact;
    private final CardinalityMode cardinalityMode;
    private final List<String> sampleValues;

    @Getter(AccessLevel.NONE)
    private final NumericDistribution numericDistribution;

    @Getter(AccessLevel.NONE)
    private final CategoricalHistogram categoricalHistogram;

    @Getter(AccessLevel.NONE)
    private final StringSummary stringSummary;

    @Getter(AccessLevel.NONE)
    private final TemporalSummary temporalSummary;

    private final List<Integer> passesExecuted;
    private final long profilingTimeMs;

    private ColumnProfile(Builder b) {
        this.columnName = b.columnName;
        this.dataType = b.dataType;
        this.typeInference = b.typeInference;
        this.rowCount = b.rowCount;
        this.nullCount = b.nullCount;
        this.distinctCount = b.distinctCount;
        this.distinctExact = b.distinctExact;
        this.cardinalityMode = b.cardinalityMode;
        this.sampleValues = Collections.unmodifiableList(new ArrayList<>(b.sampleValues));
        this.numericDistribution = b.numericDistribution;
        this.categoricalHistogram = b.categoricalHistogram;
        this.stringSummary = b.stringSummary;
        this.temporalSummary = b.temporalSummary;
        this.passesExecuted = Collections.unmodifiableList(new ArrayList<>(b.passesExecuted));
        this.profilingTimeMs = b.profilingTimeMs;
    }

    public static Builder builder(String columnName) {
        return new Builder(columnName);
    }

    public double getTypeConfidence() {
        return typeInference == null ? 0d : typeInference.getConfidence();
    }

    public double nullPercentage() {
        return rowCount == 0 ? 0d : (double) nullCount / rowCount;
    }

    public double distinctPercentage() {
        long nonNull = rowCount - nullCount;
        return nonNull == 0 ? 0d : (double) distinctCount / nonNull;
    }

    public Optional<NumericDistribution> getNumericDistribution() {
        return Optional.ofNullable(numericDistribution);
    }

    public Optional<CategoricalHistogram> getCategoricalHistogram() {
        return Optional.ofNullable(categoricalHistogram);
    }

    public Optional<StringSummary> getStringSummary() {
        return Optional.ofNullable(stringSummary);
    }

    public Optional<TemporalSummary> getTemporalSummary() {
        return Optional.ofNullable(temporalSummary);
    }

    public static class Builder {
        private final String columnName;
        private DetectedDataType dataType = DetectedDataType.UNKNOWN;
        private TypeInference typeInference;
        private long rowCount;
        private long nullCount;
        private long distinctCount;
        private boolean distinctExact;
        private CardinalityMode cardinalityMode = CardinalityMode.EXACT;
        private List<String> sampleValues = Collections.emptyList();
        private NumericDistribution numericDistribution;
        private CategoricalHistogram categoricalHistogram;
        private StringSummary stringSummary;
        private TemporalSummary temporalSummary;
        private final List<Integer> passesExecuted = new ArrayList<>();
        private long profilingTimeMs;

        private Builder(String columnName) {
            this.columnName = columnName;
        }

        public Builder dataType(DetectedDataType dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder typeInference(TypeInference typeInference) {
            this.typeInference = typeInference;
            return this;
        }

        public Builder rowCount(long rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder nullCount(long nullCount) {
            this.nullCount = nullCount;
            return this;
        }

        public Builder distinctCount(long distinctCount, boolean exact) {
            this.distinctCount = distinctCount;
            this.distinctExact = exact;
            return this;
        }

        public Builder cardinalityMode(CardinalityMode cardinalityMode) {
            this.cardinalityMode = cardinalityMode;
            return this;
        }

        public Builder sampleValues(List<String> sampleValues) {
            this.sampleValues = sampleValues;
            return this;
        }

        public Builder numericDistribution(NumericDistribution numericDistribution) {
            this.numericDistribution = numericDistribution;
            return this;
        }

        public Builder categoricalHistogram(CategoricalHistogram categoricalHistogram) {
            this.categoricalHistogram = categoricalHistogram;
            return this;
        }

        public Builder stringSummary(StringSummary stringSummary) {
            this.stringSummary = stringSummary;
            return this;
        }

        public Builder temporalSummary(TemporalSummary temporalSummary) {
            this.temporalSummary = temporalSummary;
            return this;
        }

        public Builder passExecuted(int pass) {
            this.passesExecuted.add(pass);
            return this;
        }

        public Builder profilingTimeMs(long profilingTimeMs) {
            this.profilingTimeMs = profilingTimeMs;
            return this;
        }

        public ColumnProfile build() {
            return new ColumnProfile(this);
        }
    }
}
