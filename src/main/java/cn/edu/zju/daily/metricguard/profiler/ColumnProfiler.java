package cn.edu.zju.daily.metricguard.profiler;

import static cn.edu.zju.daily.metricguard.utils.FutureUtils.await;

import cn.edu.zju.daily.metricguard.core.ExecutionContext;
import cn.edu.zju.daily.metricguard.core.error.PartialProfileException;
import cn.edu.zju.daily.metricguard.core.state.FrequencyState;
import cn.edu.zju.daily.metricguard.core.state.StandardDeviationState;
import cn.edu.zju.daily.metricguard.data.Aggregate;
import cn.edu.zju.daily.metricguard.data.AggregateFunction;
import cn.edu.zju.daily.metricguard.data.AggregateResult;
import cn.edu.zju.daily.metricguard.data.ColumnType;
import cn.edu.zju.daily.metricguard.data.QueryEngine;
import cn.edu.zju.daily.metricguard.data.TableSchema;
import cn.edu.zju.daily.metricguard.sketch.HyperLogLog;
import cn.edu.zju.daily.metricguard.sketch.KllSketch;
import cn.edu.zju.daily.metricguard.sketch.KllSketchState;
import cn.edu.zju.daily.metricguard.sketch.ReservoirSampler;
import cn.edu.zju.daily.metricguard.utils.HashUtils;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

/**
 * Profiles columns in three passes.
 *
 * <ol>
 *   <li>Sampling: infers the semantic type from a bounded sample and estimates the number of
 *       distinct values with a HyperLogLog over the full column. The estimate decides whether the
 *       distinct count is computed exactly.
 *   <li>Aggregates: row, non-null and (in exact mode) distinct counts in one aggregate query.
 *   <li>Distribution: a KLL sketch and moments for numeric columns, a top-N histogram for
 *       categorical columns, patterns and lengths for strings, and ranges for temporal columns.
 * </ol>
 *
 * <p>All randomness is seeded from {@link ProfilerConfig#getSeed()}, so profiling unchanged data
 * twice gives equal profiles.
 */
@Slf4j
public class ColumnProfiler {

    public static final int TOTAL_PASSES = 3;

    static final String TYPED_FORMAT = "ISO-8601";
    static final String DATETIME_FORMAT = "YYYY-MM-DDTHH:MM:SS";

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");
    private static final DateTimeFormatter EU_DATE = DateTimeFormatter.ofPattern("d.M.yyyy");

    private final ProfilerConfig config;
    private final TypeInferenceEngine typeInference;
    private final PatternLibrary patterns;
    private final Consumer<ProfilerProgress> progress;

    public ColumnProfiler() {
        this(new ProfilerConfig());
    }

    public ColumnProfiler(ProfilerConfig config) {
        this(config, new PatternLibrary(), null);
    }

    public ColumnProfiler(
            ProfilerConfig config, PatternLibrary patterns, Consumer<ProfilerProgress> progress) {
        config.validate();
        this.config = config;
        this.typeInference = new TypeInferenceEngine(config.getTypeConfidenceThreshold());
        this.patterns = patterns;
        this.progress = progress;
    }

    /**
     * Profiles one column.
     *
     * @throws PartialProfileException if any pass fails
     */
    public ColumnProfile profileColumn(ExecutionContext context, String column) {
        return profile(context, column, null);
    }

    /**
     * Profiles the given columns. A column whose first or second pass fails is left out of the
     * report; a column whose third pass fails keeps the results of the first two. Either way the
     * failure is recorded in the report.
     */
    public ProfilingReport profileColumns(ExecutionContext context, List<String> columns) {
        List<ColumnProfile> profiles = new ArrayList<>();
        List<ColumnProfileError> errors = new ArrayList<>();
        LOG.info("Profiling {} columns of {}", columns.size(), context.getTable());
        for (String column : columns) {
            try {
                profiles.add(profile(context, column, errors));
            } catch (PartialProfileException e) {
                LOG.warn("Profiling {} failed in pass {}", column, e.getPass(), e.getCause());
                errors.add(ColumnProfileError.of(column, e.getPass(), e.getCause()));
            }
        }
        LOG.info(
                "Profiled {} of {} columns of {}, {} errors",
                profiles.size(),
                columns.size(),
                context.getTable(),
                errors.size());
        return new ProfilingReport(context.getTable(), profiles, errors);
    }

    /** Profiles every column of the table, in schema order. */
    public ProfilingReport profileTable(ExecutionContext context) {
        TableSchema schema = await(context.getEngine().schema(context.getTable()));
        return profileColumns(context, schema.columnNames());
    }

    /**
     * @param errors sink for a failed third pass, or null to fail the whole column instead
     */
    private ColumnProfile profile(
            ExecutionContext context, String column, List<ColumnProfileError> errors) {
        long start = System.nanoTime();
        ColumnProfile.Builder builder = ColumnProfile.builder(column);

        Sampling sampling;
        try {
            report(1, column, "sampling and type inference");
            sampling = samplingPass(context, column);
        } catch (RuntimeException e) {
            throw new PartialProfileException(column, 1, e);
        }
        builder.typeInference(sampling.inference)
                .sampleValues(sampling.sampleValues)
                .cardinalityMode(sampling.mode)
                .passExecuted(1);

        Counts counts;
        try {
            report(2, column, "basic aggregates");
            counts = aggregatePass(context, column, sampling);
        } catch (RuntimeException e) {
            throw new PartialProfileException(column, 2, e);
        }
        DetectedDataType type = refineType(sampling.inference.getType(), counts.distinct);
        builder.dataType(type)
                .rowCount(counts.rows)
                .nullCount(counts.rows - counts.nonNull)
                .distinctCount(counts.distinct, counts.distinctExact)
                .passExecuted(2);

        if (counts.nonNull > 0) {
            try {
                report(3, column, "distribution of " + type);
                distributionPass(context, column, type, builder);
                builder.passExecuted(3);
            } catch (RuntimeException e) {
                if (errors == null) {
                    throw new PartialProfileException(column, 3, e);
                }
                LOG.warn("Distribution pass failed for column {}", column, e);
                errors.add(ColumnProfileError.of(column, 3, e));
            }
        }

        long elapsed = (System.nanoTime() - start) / 1_000_000;
        LOG.debug("Profiled column {} as {} in {} ms", column, type, elapsed);
        return builder.profilingTimeMs(elapsed).build();
    }

    // ---------------------------------------------------------------- pass 1

    private Sampling samplingPass(ExecutionContext context, String column) {
        QueryEngine engine = context.getEngine();
        String table = context.getTable();
        ColumnType physical = await(engine.schema(table)).typeOf(column);

        List<Object> samples = new ArrayList<>();
        await(
                engine.scan(
                        table,
                        Collections.singletonList(column),
                        config.getSampleSize(),
                        row -> samples.add(row[0])));
        TypeInference inference = typeInference.infer(samples, physical);

        Set<String> sampleValues = new LinkedHashSet<>();
        for (Object value : samples) {
            if (sampleValues.size() >= config.getMaxSampleValues()) {
                break;
            }
            if (value != null) {
                sampleValues.add(HashUtils.canonical(value));
            }
        }

        HyperLogLog hll = new HyperLogLog(config.getHllPrecision(), (int) config.getSeed());
        await(engine.scan(table, Collections.singletonList(column), -1, row -> hll.add(row[0])));
        long estimate = hll.estimate();
        CardinalityMode mode =
                estimate <= config.getExactCardinalityThreshold()
                        ? CardinalityMode.EXACT
                        : CardinalityMode.APPROXIMATE;
        LOG.debug(
                "Column {}: physical {}, inferred {}, ~{} distinct, {} mode",
                column,
                physical,
                inference.getType(),
                estimate,
                mode);
        return new Sampling(inference, new ArrayList<>(sampleValues), estimate, mode);
    }

    // ---------------------------------------------------------------- pass 2

    private Counts aggregatePass(ExecutionContext context, String column, Sampling sampling) {
        Aggregate rows = Aggregate.countRows();
        Aggregate nonNull = Aggregate.of(AggregateFunction.COUNT_NON_NULL, column);
        Aggregate distinct = Aggregate.of(AggregateFunction.COUNT_DISTINCT, column);
        List<Aggregate> aggregates = new ArrayList<>();
        aggregates.add(rows);
        aggregates.add(nonNull);
        boolean exact = sampling.mode == CardinalityMode.EXACT;
        if (exact) {
            aggregates.add(distinct);
        }
        AggregateResult result =
                await(context.getEngine().aggregate(context.getTable(), aggregates));
        long nonNullCount = result.getLong(nonNull);
        long distinctCount =
                exact
                        ? result.getLong(distinct)
                        : Math.min(sampling.distinctEstimate, nonNullCount);
        return new Counts(result.getLong(rows), nonNullCount, distinctCount, exact);
    }

    private DetectedDataType refineType(DetectedDataType inferred, long distinct) {
        if (inferred == DetectedDataType.STRING && distinct < config.getCategoricalCeiling()) {
            return DetectedDataType.CATEGORICAL;
        }
        return inferred;
    }

    // ---------------------------------------------------------------- pass 3

    private void distributionPass(
            ExecutionContext context,
            String column,
            DetectedDataType type,
            ColumnProfile.Builder builder) {
        switch (type) {
            case INTEGER:
            case DECIMAL:
                builder.numericDistribution(numeric(context, column));
                break;
            case CATEGORICAL:
            case BOOLEAN:
                builder.categoricalHistogram(categorical(context, column));
                break;
            case DATE:
            case TIMESTAMP:
                builder.temporalSummary(temporal(context, column));
                break;
            case STRING:
            case MIXED:
                builder.stringSummary(strings(context, column));
                break;
            default:
                LOG.debug("No distribution for column {} of type {}", column, type);
        }
    }

    private NumericDistribution numeric(ExecutionContext context, String column) {
        KllSketch sketch = new KllSketch(config.getKllK(), config.getSeed());
        StandardDeviationState.Accumulator moments = new StandardDeviationState.Accumulator();
        scanColumn(
                context,
                column,
                value -> {
                    Double d = toDouble(value);
                    if (d != null && !d.isNaN()) {
                        sketch.update(d);
                        moments.add(d);
                    }
                });
        KllSketchState state = sketch.snapshot();
        StandardDeviationState stats = moments.toState();

        Map<String, Double> quantiles = new LinkedHashMap<>();
        for (double q : config.getQuantiles()) {
            quantiles.put(NumericDistribution.quantileName(q), state.quantile(q));
        }
        double q1 = state.quantile(0.25);
        double q3 = state.quantile(0.75);
        double iqr = q3 - q1;
        double lowerFence = q1 - config.getOutlierIqrMultiplier() * iqr;
        double upperFence = q3 + config.getOutlierIqrMultiplier() * iqr;
        long n = state.getN();
        long outliers = 0;
        if (n > 0) {
            long below = Math.round(state.rank(Math.nextDown(lowerFence)) * n);
            long above = n - Math.round(state.rank(upperFence) * n);
            outliers = below + above;
        }
        return new NumericDistribution(
                stats.getCount(),
                state.getMin(),
                state.getMax(),
                stats.getMean(),
                stats.stddev(),
                stats.variance(),
                quantiles,
                lowerFence,
                upperFence,
                outliers);
    }

    private CategoricalHistogram categorical(ExecutionContext context, String column) {
        Map<String, Long> frequencies = new HashMap<>();
        long[] rows = new long[1];
        scanColumn(
                context,
                column,
                value -> {
                    rows[0]++;
                    if (value != null) {
                        frequencies.merge(HashUtils.canonical(value), 1L, Long::sum);
                    }
                });
        return CategoricalHistogram.fromFrequencies(
                new FrequencyState(frequencies, rows[0]), config.getHistogramTopN());
    }

    private StringSummary strings(ExecutionContext context, String column) {
        ReservoirSampler<String> reservoir =
                new ReservoirSampler<>(
                        config.getPatternSampleSize(), new Random(config.getSeed()));
        int[] minMax = {Integer.MAX_VALUE, 0};
        long[] totals = new long[2];
        scanColumn(
                context,
                column,
                value -> {
                    if (value == null) {
                        return;
                    }
                    String s = HashUtils.canonical(value);
                    reservoir.update(s);
                    minMax[0] = Math.min(minMax[0], s.length());
                    minMax[1] = Math.max(minMax[1], s.length());
                    totals[0]++;
                    totals[1] += s.length();
                });
        List<String> sample = reservoir.samples();
        if (totals[0] == 0) {
            return new StringSummary(0, 0, 0d, 0, Collections.emptyMap());
        }
        return new StringSummary(
                minMax[0],
                minMax[1],
                (double) totals[1] / totals[0],
                sample.size(),
                patterns.match(sample));
    }

    private TemporalSummary temporal(ExecutionContext context, String column) {
        LocalDateTime[] range = new LocalDateTime[2];
        Map<String, Long> formats = new HashMap<>();
        long[] unparseable = new long[1];
        boolean[] dateOnly = {true};
        scanColumn(
                context,
                column,
                value -> {
                    if (value == null) {
                        return;
                    }
                    Pair<LocalDateTime, String> parsed = parseTemporal(value);
                    if (parsed == null) {
                        unparseable[0]++;
                        return;
                    }
                    LocalDateTime t = parsed.getLeft();
                    String format = parsed.getRight();
                    if (format.equals(DATETIME_FORMAT)
                            || (format.equals(TYPED_FORMAT) && !(value instanceof LocalDate))) {
                        dateOnly[0] = false;
                    }
                    formats.merge(format, 1L, Long::sum);
                    if (range[0] == null || t.isBefore(range[0])) {
                        range[0] = t;
                    }
                    if (range[1] == null || t.isAfter(range[1])) {
                        range[1] = t;
                    }
                });
        long parsed = formats.values().stream().mapToLong(Long::longValue).sum();
        if (parsed == 0) {
            return new TemporalSummary(null, null, 0, null, 0d, unparseable[0]);
        }
        Map.Entry<String, Long> dominant = null;
        for (Map.Entry<String, Long> e : formats.entrySet()) {
            if (dominant == null
                    || e.getValue() > dominant.getValue()
                    || (e.getValue().equals(dominant.getValue())
                            && e.getKey().compareTo(dominant.getKey()) < 0)) {
                dominant = e;
            }
        }
        String earliest =
                dateOnly[0] ? range[0].toLocalDate().toString() : range[0].toString();
        String latest = dateOnly[0] ? range[1].toLocalDate().toString() : range[1].toString();
        return new TemporalSummary(
                earliest,
                latest,
                ChronoUnit.DAYS.between(range[0].toLocalDate(), range[1].toLocalDate()),
                dominant.getKey(),
                (double) dominant.getValue() / (parsed + unparseable[0]),
                unparseable[0]);
    }

    /** The instant a value denotes, in UTC, with the format it was written in. */
    static Pair<LocalDateTime, String> parseTemporal(Object value) {
        if (value instanceof LocalDate) {
            return Pair.of(((LocalDate) value).atStartOfDay(), TYPED_FORMAT);
        }
        if (value instanceof LocalDateTime) {
            return Pair.of((LocalDateTime) value, TYPED_FORMAT);
        }
        if (value instanceof Instant) {
            return Pair.of(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC), TYPED_FORMAT);
        }
        if (value instanceof OffsetDateTime) {
            return Pair.of(toUtc((OffsetDateTime) value), TYPED_FORMAT);
        }
        if (value instanceof ZonedDateTime) {
            return Pair.of(
                    LocalDateTime.ofInstant(((ZonedDateTime) value).toInstant(), ZoneOffset.UTC),
                    TYPED_FORMAT);
        }
        String s = StringUtils.trimToEmpty(value.toString());
        try {
            if (TypeInferenceEngine.DATETIME_ISO.matcher(s).matches()) {
                return Pair.of(parseDateTime(s), DATETIME_FORMAT);
            }
            String format = TypeInferenceEngine.dateFormat(s);
            if (format == null) {
                return null;
            }
            switch (format) {
                case "MM/DD/YYYY":
                    return Pair.of(LocalDate.parse(s, US_DATE).atStartOfDay(), format);
                case "DD.MM.YYYY":
                    return Pair.of(LocalDate.parse(s, EU_DATE).atStartOfDay(), format);
                default:
                    return Pair.of(LocalDate.parse(s).atStartOfDay(), format);
            }
        } catch (DateTimeParseException e) {
            LOG.trace("Unparseable temporal value {}", s);
            return null;
        }
    }

    private static LocalDateTime parseDateTime(String s) {
        String iso = s.replace(' ', 'T');
        try {
            return LocalDateTime.parse(iso);
        } catch (DateTimeParseException e) {
            return toUtc(OffsetDateTime.parse(iso));
        }
    }

    private static LocalDateTime toUtc(OffsetDateTime t) {
        return t.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    /** Numeric value of a number or a numeric string; null otherwise. */
    static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (TypeInferenceEngine.DECIMAL.matcher(s).matches()) {
                return Double.parseDouble(s);
            }
        }
        return null;
    }

    private void scanColumn(ExecutionContext context, String column, Consumer<Object> consumer) {
        await(
                context.getEngine()
                        .scan(
                                context.getTable(),
                                Collections.singletonList(column),
                                -1,
                                row -> consumer.accept(row[0])));
    }

    private void report(int pass, String column, String message) {
        if (progress == null) {
            return;
        }
        try {
            progress.accept(new ProfilerProgress(pass, TOTAL_PASSES, column, message));
        } catch (RuntimeException e) {
            LOG.warn("Progress callback failed for column {} pass {}", column, pass, e);
        }
    }

    public ProfilerConfig getConfig() {
        return config;
    }

    private static class Sampling {
        final TypeInference inference;
        final List<String> sampleValues;
        final long distinctEstimate;
        final CardinalityMode mode;

        Sampling(
                TypeInference inference,
                List<String> sampleValues,
                long distinctEstimate,
                CardinalityMode mode) {
            this.inference = inference;
            this.sampleValues = sampleValues;
            this.distinctEstimate = distinctEstimate;
            this.mode = mode;
        }
    }

    private static class Counts {
        final long rows;
        final long nonNull;
        final long distinct;
        final boolean distinctExact;

        Counts(long rows, long nonNull, long distinct, boolean distinctExact) {
            this.rows = rows;
            this.nonNull = nonNull;
            this.distinct = distinct;
            this.distinctExact = distinctExact;
        }
    }
}
