package cn.edu.zju.daily.metricguard.core.state;

import static cn.edu.zju.daily.metricguard.utils.JsonUtils.getDouble;
import static cn.edu.zju.daily.metricguard.utils.JsonUtils.putDouble;
import static cn.edu.zju.daily.metricguard.utils.JsonUtils.toDoubleArray;
import static cn.edu.zju.daily.metricguard.utils.JsonUtils.toJsonArray;

import cn.edu.zju.daily.metricguard.sketch.HyperLogLogState;
import cn.edu.zju.daily.metricguard.sketch.KllSketchState;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Type-tagged JSON encoding of every {@link AnalyzerState}, used to persist states between
 * incremental runs and to emit sketches as metrics. A decoded state equals the encoded one.
 */
public final class StateCodec {

    private static final String TYPE = "type";

    private StateCodec() {}

    public static byte[] encode(AnalyzerState<?> state) {
        return toJson(state).toString().getBytes(StandardCharsets.UTF_8);
    }

    public static AnalyzerState<?> decode(byte[] bytes) {
        try {
            return fromJson(new JSONObject(new String(bytes, StandardCharsets.UTF_8)));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed state payload", e);
        }
    }

    /** Decodes and checks that the state is of the expected class. */
    public static <S extends AnalyzerState<S>> S decode(byte[] bytes, Class<S> stateClass) {
        AnalyzerState<?> state = decode(bytes);
        if (!stateClass.isInstance(state)) {
            throw new IllegalArgumentException(
                    "Expected "
                            + stateClass.getSimpleName()
                            + " but found "
                            + state.getClass().getSimpleName());
        }
        return stateClass.cast(state);
    }

    /** Short tag naming the state shape, e.g. {@code "hll"}. */
    public static String typeOf(AnalyzerState<?> state) {
        return toJson(state).getString(TYPE);
    }

    public static JSONObject toJson(AnalyzerState<?> state) {
        JSONObject obj = new JSONObject();
        if (state instanceof SizeState) {
            obj.put(TYPE, "size");
            obj.put("count", ((SizeState) state).getCount());
        } else if (state instanceof SumState) {
            SumState s = (SumState) state;
            obj.put(TYPE, "sum");
            putDouble(obj, "sum", s.getSum());
            obj.put("count", s.getCount());
        } else if (state instanceof MeanState) {
            MeanState s = (MeanState) state;
            obj.put(TYPE, "mean");
            putDouble(obj, "sum", s.getSum());
            obj.put("count", s.getCount());
        } else if (state instanceof MinState) {
            MinState s = (MinState) state;
            obj.put(TYPE, "min");
            putDouble(obj, "value", s.getMin());
            obj.put("count", s.getCount());
        } else if (state instanceof MaxState) {
            MaxState s = (MaxState) state;
            obj.put(TYPE, "max");
            putDouble(obj, "value", s.getMax());
            obj.put("count", s.getCount());
        } else if (state instanceof StandardDeviationState) {
            StandardDeviationState s = (StandardDeviationState) state;
            obj.put(TYPE, "stddev");
            obj.put("count", s.getCount());
            putDouble(obj, "mean", s.getMean());
            putDouble(obj, "m2", s.getM2());
        } else if (state instanceof RatioState) {
            RatioState s = (RatioState) state;
            obj.put(TYPE, "ratio");
            obj.put("matches", s.getMatches());
            obj.put("count", s.getCount());
        } else if (state instanceof FrequencyState) {
            FrequencyState s = (FrequencyState) state;
            obj.put(TYPE, "frequency");
            obj.put("frequencies", new JSONObject(s.getFrequencies()));
            obj.put("numRows", s.getNumRows());
        } else if (state instanceof CorrelationState) {
            CorrelationState s = (CorrelationState) state;
            obj.put(TYPE, "correlation");
            obj.put("count", s.getCount());
            putDouble(obj, "xMean", s.getXMean());
            putDouble(obj, "yMean", s.getYMean());
            putDouble(obj, "coMoment", s.getCoMoment());
            putDouble(obj, "xM2", s.getXM2());
            putDouble(obj, "yM2", s.getYM2());
        } else if (state instanceof MutualInformationState) {
            MutualInformationState s = (MutualInformationState) state;
            obj.put(TYPE, "mutual_information");
            obj.put("bins", s.getBins());
            obj.put("joint", toJson(s.getJoint()));
            obj.put("first", toJson(s.getFirst()));
            obj.put("second", toJson(s.getSecond()));
        } else if (state instanceof GroupedState) {
            JSONObject groups = new JSONObject();
            ((GroupedState<?>) state).getGroups().forEach((k, v) -> groups.put(k, toJson(v)));
            obj.put(TYPE, "grouped");
            obj.put("groups", groups);
        } else if (state instanceof DataTypeState) {
            obj.put(TYPE, "datatype");
            obj.put("counts", new JSONObject(((DataTypeState) state).getCounts()));
        } else if (state instanceof HyperLogLogState) {
            HyperLogLogState s = (HyperLogLogState) state;
            obj.put(TYPE, "hll");
            obj.put("precision", s.getPrecision());
            obj.put("seed", s.getSeed());
            obj.put("registers", Base64.getEncoder().encodeToString(s.getRegisters()));
        } else if (state instanceof KllSketchState) {
            KllSketchState s = (KllSketchState) state;
            obj.put(TYPE, "kll");
            obj.put("k", s.getK());
            obj.put("seed", s.getSeed());
            obj.put("n", s.getN());
            putDouble(obj, "min", s.getMin());
            putDouble(obj, "max", s.getMax());
            JSONArray levels = new JSONArray();
            for (double[] level : s.getLevels()) {
                levels.put(toJsonArray(level));
            }
            obj.put("levels", levels);
        } else {
            throw new IllegalArgumentException(
                    "No encoding for state " + state.getClass().getName());
        }
        return obj;
    }

    public static AnalyzerState<?> fromJson(JSONObject obj) {
        String type = obj.getString(TYPE);
        switch (type) {
            case "size":
                return new SizeState(obj.getLong("count"));
            case "sum":
                return new SumState(getDouble(obj, "sum"), obj.getLong("count"));
            case "mean":
                return new MeanState(getDouble(obj, "sum"), obj.getLong("count"));
            case "min":
                return new MinState(getDouble(obj, "value"), obj.getLong("count"));
            case "max":
                return new MaxState(getDouble(obj, "value"), obj.getLong("count"));
            case "stddev":
                return new StandardDeviationState(
                        obj.getLong("count"), getDouble(obj, "mean"), getDouble(obj, "m2"));
            case "ratio":
                return new RatioState(obj.getLong("matches"), obj.getLong("count"));
            case "frequency":
                return new FrequencyState(
                        toLongMap(obj.getJSONObject("frequencies")), obj.getLong("numRows"));
            case "correlation":
                return new CorrelationState(
                        obj.getLong("count"),
                        getDouble(obj, "xMean"),
                        getDouble(obj, "yMean"),
                        getDouble(obj, "coMoment"),
                        getDouble(obj, "xM2"),
                        getDouble(obj, "yM2"));
            case "mutual_information":
                return new MutualInformationState(
                        (FrequencyState) fromJson(obj.getJSONObject("joint")),
                        (FrequencyState) fromJson(obj.getJSONObject("first")),
                        (FrequencyState) fromJson(obj.getJSONObject("second")),
                        obj.getInt("bins"));
            case "grouped":
                return groupedFromJson(obj.getJSONObject("groups"));
            case "datatype":
                return new DataTypeState(toLongMap(obj.getJSONObject("counts")));
            case "hll":
                return new HyperLogLogState(
                        obj.getInt("precision"),
                        obj.getInt("seed"),
                        Base64.getDecoder().decode(obj.getString("registers")));
            case "kll":
                JSONArray rawLevels = obj.getJSONArray("levels");
                double[][] levels = new double[rawLevels.length()][];
                for (int h = 0; h < levels.length; h++) {
                    levels[h] = toDoubleArray(rawLevels.getJSONArray(h));
                }
                return new KllSketchState(
                        obj.getInt("k"),
                        obj.getLong("seed"),
                        obj.getLong("n"),
                        getDouble(obj, "min"),
                        getDouble(obj, "max"),
                        levels);
            default:
                throw new IllegalArgumentException("Unknown state type " + type);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static AnalyzerState<?> groupedFromJson(JSONObject obj) {
        Map<String, AnalyzerState> groups = new HashMap<>();
        for (String key : obj.keySet()) {
            groups.put(key, fromJson(obj.getJSONObject(key)));
        }
        return new GroupedState(groups);
    }

    private static Map<String, Long> toLongMap(JSONObject obj) {
        Map<String, Long> map = new HashMap<>();
        for (String key : obj.keySet()) {
            map.put(key, obj.getLong(key));
        }
        return map;
    }
}
