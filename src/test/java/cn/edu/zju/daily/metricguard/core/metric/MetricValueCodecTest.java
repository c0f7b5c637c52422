package cn.edu.zju.daily.metricguard.core.metric;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

class MetricValueCodecTest {

    private static MetricValue roundTrip(MetricValue value) {
        return MetricValueCodec.decode(MetricValueCodec.encode(value));
    }

    @Test
    void testScalars() {
        assertEquals(MetricValue.of(42L), roundTrip(MetricValue.of(42L)));
        assertEquals(MetricValue.of(0.125), roundTrip(MetricValue.of(0.125)));
        assertEquals(MetricValue.of(1d), roundTrip(MetricValue.of(1d)));
        assertEquals(MetricValue.of("mode"), roundTrip(MetricValue.of("mode")));
    }

    @Test
    void testNonFiniteDoubles() {
        MetricValue nan = roundTrip(MetricValue.of(Double.NaN));
        assertTrue(Double.isNaN(nan.asDouble().getAsDouble()));

        MetricValue inf = roundTrip(MetricValue.of(Double.NEGATIVE_INFINITY));
        assertEquals(Double.NEGATIVE_INFINITY, inf.asDouble().getAsDouble());
    }

    @Test
    void testDistributionKeepsOrder() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("0.9", 9d);
        values.put("0.1", 1d);
        values.put("0.5", Double.NaN);
        MetricValue decoded = roundTrip(MetricValue.distribution(values));

        assertEquals(MetricValue.Kind.DISTRIBUTION, decoded.kind());
        MetricValue.DistributionValue dist = (MetricValue.DistributionValue) decoded;
        assertEquals(
                Arrays.asList("0.9", "0.1", "0.5"), new ArrayList<>(dist.getValues().keySet()));
        assertEquals(9d, dist.get("0.9").getAsDouble());
        assertTrue(Double.isNaN(dist.get("0.5").getAsDouble()));
        assertFalse(dist.get("0.7").isPresent());
        assertFalse(decoded.isNumeric());
    }

    @Test
    void testSketch() {
        MetricValue sketch = MetricValue.sketch("hll", new byte[] {1, 2, 3, -4});
        JSONObject json = MetricValueCodec.toJson(sketch);
        assertEquals("SKETCH", json.getString("type"));
        assertEquals("hll", json.getString("sketchType"));

        MetricValue decoded = MetricValueCodec.fromJson(json);
        assertEquals(sketch, decoded);
        assertArrayEquals(
                new byte[] {1, 2, 3, -4}, ((MetricValue.SketchValue) decoded).getPayload());
    }

    @Test
    void testUnknownKind() {
        assertThrows(
                IllegalArgumentException.class,
                () -> MetricValueCodec.decode("{\"type\":\"MATRIX\",\"value\":1}"));
        assertThrows(
                IllegalArgumentException.class, () -> MetricValueCodec.decode("{\"value\":1}"));
    }

    @Test
    void testNumericView() {
        assertEquals(3d, MetricValue.of(3L).asDouble().getAsDouble());
        assertTrue(MetricValue.of(2.5).isNumeric());
        assertFalse(MetricValue.of("x").isNumeric());
        assertEquals("0.3333", MetricValue.of(1d / 3).toString());
        assertEquals("4", MetricValue.of(4d).toString());
    }
}
