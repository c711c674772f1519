package com.kotsin.structure.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MathUtils")
class MathUtilsTest {

    // ========== Safe division ==========

    @Test
    @DisplayName("Division by zero, NaN or Infinity returns the default")
    void testSafeDivide() {
        assertEquals(2.5, MathUtils.safeDivide(5, 2, 0.0));
        assertEquals(-1.0, MathUtils.safeDivide(5, 0, -1.0));
        assertEquals(-1.0, MathUtils.safeDivide(5, 1e-12, -1.0));
        assertEquals(-1.0, MathUtils.safeDivide(5, Double.NaN, -1.0));
        assertEquals(-1.0, MathUtils.safeDivide(Double.POSITIVE_INFINITY, 2, -1.0));
    }

    // ========== Rounding ==========

    @Test
    @DisplayName("roundOrNull rounds half-up and maps invalid values to null")
    void testRoundOrNull() {
        assertEquals(147.08, MathUtils.roundOrNull(147.083333, 2));
        assertEquals(0.13, MathUtils.roundOrNull(0.125, 2));
        assertEquals(-21.49, MathUtils.roundOrNull(-21.4949, 2));
        assertNull(MathUtils.roundOrNull(null, 2));
        assertNull(MathUtils.roundOrNull(Double.NaN, 2));
        assertNull(MathUtils.roundOrNull(Double.NEGATIVE_INFINITY, 2));
    }

    // ========== Clamping ==========

    @Test
    @DisplayName("Clamp bounds values and maps NaN to the minimum")
    void testClamp() {
        assertEquals(100.0, MathUtils.clamp(250.0, -100.0, 100.0));
        assertEquals(-100.0, MathUtils.clamp(-250.0, -100.0, 100.0));
        assertEquals(0.0, MathUtils.clampConfidence(Double.NaN));
        assertEquals(1.0, MathUtils.clampConfidence(1.7));
    }

    @Test
    @DisplayName("Sign treats values within epsilon as zero")
    void testSign() {
        assertEquals(1, MathUtils.sign(0.5));
        assertEquals(-1, MathUtils.sign(-3));
        assertEquals(0, MathUtils.sign(1e-12));
    }
}
