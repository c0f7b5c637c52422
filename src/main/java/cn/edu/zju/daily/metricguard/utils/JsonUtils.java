package cn.edu.zju.daily.metricguard.utils;

import org.json.JSONArray;
import org.json.JSONObject;

public class JsonUtils {

    /** JSON has no NaN or infinities, so those are written as strings. */
    public static void putDouble(JSONObject obj, String key, double value) {
        if (Double.isFinite(value)) {
            obj.put(key, value);
        } else {
            obj.put(key, Double.toString(value));
        }
    }

    public static double getDouble(JSONObject obj, String key) {
        return toDouble(obj.get(key));
    }

    public static JSONArray toJsonArray(double[] values) {
        JSONArray array = new JSONArray();
        for (double v : values) {
            if (Double.isFinite(v)) {
                array.put(v);
            } else {
                array.put(Double.toString(v));
            }
        }
        return array;
    }

    public static double[] toDoubleArray(JSONArray array) {
        double[] values = new double[array.length()];
        for (int i = 0; i < values.length; i++) {
            values[i] = toDouble(array.get(i));
        }
        return values;
    }

    private static double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        return Double.parseDouble(raw.toString());
    }
}
