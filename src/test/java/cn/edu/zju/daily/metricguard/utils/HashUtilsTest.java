package cn.edu.zju.daily.metricguard.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class HashUtilsTest {

    @Test
    void testCanonicalNumbers() {
        assertEquals("10", HashUtils.canonical(10));
        assertEquals("10", HashUtils.canonical(10L));
        assertEquals("10", HashUtils.canonical(10.0));
        assertEquals("10", HashUtils.canonical(new BigDecimal("10.00")));
        assertEquals("10.5", HashUtils.canonical(10.5f));
        assertEquals("null", HashUtils.canonical(null));
        assertEquals(HashUtils.hash32(10, 1), HashUtils.hash32(10.0, 1));
        assertNotEquals(HashUtils.hash32("a", 1), HashUtils.hash32("b", 1));
    }

    @Test
    void testSymmetricSeed() {
        assertEquals(HashUtils.symmetricSeed(3, 9), HashUtils.symmetricSeed(9, 3));
        assertNotEquals(HashUtils.symmetricSeed(3, 9), HashUtils.symmetricSeed(3, 10));
    }
}
