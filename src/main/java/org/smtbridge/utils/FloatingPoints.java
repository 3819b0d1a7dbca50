package org.smtbridge.utils;

import org.apache.commons.lang3.StringUtils;

/**
 * IEEE-754 位模式与 SMT-LIB2 {@code (fp s e m)} 三元组之间的转换。
 */
public final class FloatingPoints {

    public static final int FLOAT_EXPONENT_WIDTH = 8;
    public static final int FLOAT_SIGNIFICAND_WIDTH = 23;
    public static final int DOUBLE_EXPONENT_WIDTH = 11;
    public static final int DOUBLE_SIGNIFICAND_WIDTH = 52;

    private FloatingPoints() {
    }

    public static float floatFromTriple(long sign, long exponent, long significand) {
        int bits = (int) ((sign << 31) | (exponent << FLOAT_SIGNIFICAND_WIDTH) | significand);
        return Float.intBitsToFloat(bits);
    }

    public static double doubleFromTriple(long sign, long exponent, long significand) {
        return Double.longBitsToDouble((sign << 63) | (exponent << DOUBLE_SIGNIFICAND_WIDTH) | significand);
    }

    public static String toTriple(float value) {
        return toTriple(Integer.toUnsignedLong(Float.floatToRawIntBits(value)),
                FLOAT_EXPONENT_WIDTH, FLOAT_SIGNIFICAND_WIDTH);
    }

    public static String toTriple(double value) {
        return toTriple(Double.doubleToRawLongBits(value), DOUBLE_EXPONENT_WIDTH, DOUBLE_SIGNIFICAND_WIDTH);
    }

    // 保留原始位，NaN 的载荷和零的符号都不会丢失
    private static String toTriple(long bits, int exponentWidth, int significandWidth) {
        long sign = (bits >>> (exponentWidth + significandWidth)) & 1L;
        long exponent = (bits >>> significandWidth) & ((1L << exponentWidth) - 1);
        long significand = bits & ((1L << significandWidth) - 1);
        return "(fp #b" + sign
                + " #b" + StringUtils.leftPad(Long.toBinaryString(exponent), exponentWidth, '0')
                + " #b" + StringUtils.leftPad(Long.toBinaryString(significand), significandWidth, '0') + ")";
    }
}
