package cn.edu.zju.daily.metricguard.core.state;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.metricguard.sketch.HyperLogLog;
import cn.edu.zju.daily.metricguard.sketch.HyperLogLogState;
import cn.edu.zju.daily.metricguard.sketch.KllSketch;
import cn.edu.zju.daily.metricguard.sketch.KllSketchState;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StateCodecTest {

    @Test
    void testScalarStates() {
        assertEquals(new SizeState(42), StateCodec.decode(StateCodec.encode(new SizeState(42))));
        MeanState mean = MeanState.of(1.5, 2.5);
        assertEquals(mean, StateCodec.decode(StateCodec.encode(mean), MeanState.class));
        assertEquals("size", StateCodec.typeOf(new SizeState(1)));
    }

    @Test
    void testEmptyMinKeepsInfinity() {
        MinState decoded = StateCodec.decode(StateCodec.encode(MinState.EMPTY), MinState.class);
        assertEquals(MinState.EMPTY, decoded);
        assertTrue(Double.isInfinite(decoded.getMin()));
    }

    @Test
    void testFrequencyState() {
        Map<String, Long> freq = new HashMap<>();
        freq.put("x", 3L);
        freq.put(FrequencyState.NULL_KEY, 1L);
        FrequencyState state = new FrequencyState(freq, 4);
        assertEquals(state, StateCodec.decode(StateCodec.encode(state)));
    }

    @Test
    void testNestedStates() {
        Map<String, MeanState> means = new HashMap<>();
        means.put("eu", MeanState.of(1, 2));
        means.put("us", MeanState.of(5));
        GroupedState<MeanState> grouped = new GroupedState<>(means);
        assertEquals(grouped, StateCodec.decode(StateCodec.encode(grouped)));
        assertEquals("grouped", StateCodec.typeOf(grouped));
        GroupedState<MeanState> empty = GroupedState.empty();
        assertEquals(empty, StateCodec.decode(StateCodec.encode(empty)));

        Map<String, Long> freq = new HashMap<>();
        freq.put(MutualInformationState.pairKey("a", "b"), 2L);
        MutualInformationState mi =
                new MutualInformationState(
                        new FrequencyState(freq, 3),
                        new FrequencyState(Collections.singletonMap("a", 2L), 3),
                        new FrequencyState(Collections.singletonMap("b", 2L), 3),
                        5);
        assertEquals(mi, StateCodec.decode(StateCodec.encode(mi)));
    }

    @Test
    void testSketchStates() {
        HyperLogLog hll = new HyperLogLog(10, 7);
        for (int i = 0; i < 1000; i++) {
            hll.add("key-" + i);
        }
        HyperLogLogState hllState = hll.snapshot();
        HyperLogLogState decodedHll =
                StateCodec.decode(StateCodec.encode(hllState), HyperLogLogState.class);
        assertEquals(hllState, decodedHll);
        assertEquals(hllState.estimate(), decodedHll.estimate());

        KllSketch kll = new KllSketch(50, 1L);
        for (int i = 0; i < 5000; i++) {
            kll.update(i);
        }
        KllSketchState kllState = kll.snapshot();
        KllSketchState decodedKll =
                StateCodec.decode(StateCodec.encode(kllState), KllSketchState.class);
        assertEquals(kllState, decodedKll);
        assertEquals(kllState.quantile(0.5), decodedKll.quantile(0.5));
    }

    @Test
    void testWrongClassRejected() {
        byte[] bytes = StateCodec.encode(new SizeState(1));
        assertThrows(
                IllegalArgumentException.class, () -> StateCodec.decode(bytes, MeanState.class));
    }

    @Test
    void testMalformedPayloadRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> StateCodec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(
                IllegalArgumentException.class,
                () -> StateCodec.decode("{\"type\":\"nope\"}".getBytes(StandardCharsets.UTF_8)));
    }
}
