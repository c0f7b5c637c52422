package cn.edu.zju.daily.metricguard.core.metric;

import static cn.edu.zju.daily.metricguard.utils.JsonUtils.getDouble;
import static cn.edu.zju.daily.metricguard.utils.JsonUtils.putDouble;

import cn.edu.zju.daily.metricguard.core.metric.MetricValue.DistributionValue;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue.DoubleValue;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue.LongValue;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue.SketchValue;
import cn.edu.zju.daily.metricguard.core.metric.MetricValue.StringValue;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/** JSON form of {@link MetricValue}. Every kind round-trips unchanged. */
public final class MetricValueCodec {

    private static final String TYPE = "type";
    private static final String VALUE = "value";
    private static final String SKETCH_TYPE = "sketchType";

    private MetricValueCodec() {}

    public static JSONObject toJson(MetricValue value) {
        JSONObject obj = new JSONObject();
        obj.put(TYPE, value.kind().name());
        switch (value.kind()) {
            case LONG:
                obj.put(VALUE, ((LongValue) value).getValue());
                break;
            case DOUBLE:
                putDouble(obj, VALUE, ((DoubleValue) value).getValue());
                break;
            case STRING:
                obj.put(VALUE, ((StringValue) value).getValue());
                break;
            case DISTRIBUTION:
                JSONArray entries = new JSONArray();
                for (Map.Entry<String, Double> e :
                        ((DistributionValue) value).getValues().entrySet()) {
                    JSONObject entry = new JSONObject();
                    entry.put("name", e.getKey());
                    putDouble(entry, VALUE, e.getValue());
                    entries.put(entry);
                }
                obj.put(VALUE, entries);
                break;
            case SKETCH:
                SketchValue sketch = (SketchValue) value;
                obj.put(SKETCH_TYPE, sketch.getSketchType());
                obj.put(VALUE, Base64.getEncoder().encodeToString(sketch.getPayload()));
                break;
            default:
                throw new IllegalArgumentException("Unknown metric kind " + value.kind());
        }
        return obj;
    }

    public static MetricValue fromJson(JSONObject obj) {
        MetricValue.Kind kind;
        try {
            kind = MetricValue.Kind.valueOf(obj.getString(TYPE));
        } catch (JSONException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a metric value: " + obj, e);
        }
        switch (kind) {
            case LONG:
                return MetricValue.of(obj.getLong(VALUE));
            case DOUBLE:
                return MetricValue.of(getDouble(obj, VALUE));
            case STRING:
                return MetricValue.of(obj.getString(VALUE));
            case DISTRIBUTION:
                JSONArray entries = obj.getJSONArray(VALUE);
                Map<String, Double> values = new LinkedHashMap<>();
                for (int i = 0; i < entries.length(); i++) {
                    JSONObject entry = entries.getJSONObject(i);
                    values.put(entry.getString("name"), getDouble(entry, VALUE));
                }
                return MetricValue.distribution(values);
            case SKETCH:
                return MetricValue.sketch(
                        obj.getString(SKETCH_TYPE),
                        Base64.getDecoder().decode(obj.getString(VALUE)));
            default:
                throw new IllegalArgumentException("Unknown metric kind " + kind);
        }
    }

    public static String encode(MetricValue value) {
        return toJson(value).toString();
    }

    public static MetricValue decode(String json) {
        return fromJson(new JSONObject(json));
    }
}
