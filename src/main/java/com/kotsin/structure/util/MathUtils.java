package com.kotsin.structure.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * MathUtils - Safe mathematical operations with NaN/Infinity/Division-by-zero protection
 *
 * Every floating value that leaves the analytics core goes through {@link #roundOrNull}
 * so that NaN and Infinity are never serialised.
 *
 * USAGE:
 * Instead of: double result = a / b;
 * Use: double result = MathUtils.safeDivide(a, b, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // Epsilon for floating point comparisons
    private static final double EPSILON = 1e-10;

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     *
     * @param numerator   The numerator
     * @param denominator The denominator
     * @param defaultValue Value to return if division is unsafe
     * @return Result of division or defaultValue
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        if (!isValidNumber(result)) {
            return defaultValue;
        }
        return result;
    }

    /**
     * Check if a number is valid for use as a denominator
     */
    public static boolean isValidDenominator(double value) {
        return Math.abs(value) > EPSILON && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    // ======================== NUMBER VALIDATION ========================

    /**
     * Check if a number is valid (not NaN, not Infinite)
     */
    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Null-safe variant for boxed values
     */
    public static boolean isValidNumber(Double value) {
        return value != null && isValidNumber(value.doubleValue());
    }

    // ======================== ROUNDING ========================

    /**
     * Round half-up to the given scale; null for null, NaN or Infinity.
     */
    public static Double roundOrNull(Double value, int scale) {
        if (!isValidNumber(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    // ======================== CLAMPING ========================

    /**
     * Clamp value to range [min, max]
     */
    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp to [0, 1], used for confidences
     */
    public static double clampConfidence(double value) {
        return clamp(value, 0.0, 1.0);
    }

    /**
     * Sign of value treating |value| below epsilon as zero
     */
    public static int sign(double value) {
        if (Math.abs(value) <= EPSILON) {
            return 0;
        }
        return value > 0 ? 1 : -1;
    }
}
