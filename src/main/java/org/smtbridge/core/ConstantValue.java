package org.smtbridge.core;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.utils.AlgebraicReal;
import org.smtbridge.utils.FloatingPoints;
import org.smtbridge.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * 带类型的常量值，Kind 决定了哪个载荷字段有效：
 * <ul>
 *     <li>BOOL / BOUNDED / UNBOUNDED: {@link #getIntegerValue()}；</li>
 *     <li>REAL: {@link #getRealValue()}；</li>
 *     <li>FLOAT / DOUBLE: {@link #getFloatValue()} / {@link #getDoubleValue()}；</li>
 *     <li>USER_SORT: 元素名，以及可选的枚举下标。</li>
 * </ul>
 * 浮点值按位比较，因此 NaN 等于 NaN，+0 不等于 -0。
 */
@Getter
public final class ConstantValue {

    private static final Logger logger = LoggerFactory.getLogger(ConstantValue.class);

    private final Kind kind;
    private final BigInteger integerValue;
    private final AlgebraicReal realValue;
    private final float floatValue;
    private final double doubleValue;
    private final String elementName;
    private final Integer elementIndex;

    private ConstantValue(Kind kind, BigInteger integerValue, AlgebraicReal realValue,
                          float floatValue, double doubleValue, String elementName, Integer elementIndex) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.integerValue = integerValue;
        this.realValue = realValue;
        this.floatValue = floatValue;
        this.doubleValue = doubleValue;
        this.elementName = elementName;
        this.elementIndex = elementIndex;
    }

    /**
     * 按 Kind 解释一个整数字面量。位向量按宽度截断：无符号取模 2^n，带符号取补码。
     * @throws IllegalArgumentException 当 Kind 是未解释排序时。
     */
    public static ConstantValue of(Kind kind, BigInteger magnitude) {
        Objects.requireNonNull(magnitude, "Magnitude cannot be null");
        return switch (kind.getType()) {
            case BOOL -> ofBool(magnitude.signum() != 0);
            case BOUNDED -> new ConstantValue(kind, normalize(kind, magnitude), null, 0f, 0d, null, null);
            case UNBOUNDED -> new ConstantValue(kind, magnitude, null, 0f, 0d, null, null);
            case REAL -> ofReal(AlgebraicReal.exact(Rational.valueOf(magnitude)));
            case FLOAT -> ofFloat(magnitude.floatValue());
            case DOUBLE -> ofDouble(magnitude.doubleValue());
            case USER_SORT -> {
                logger.error("无法把整数 {} 解释为未解释排序 {} 的元素", magnitude, kind);
                throw new IllegalArgumentException("Cannot build an integer constant of uninterpreted sort " + kind);
            }
        };
    }

    public static ConstantValue of(Kind kind, long magnitude) {
        return of(kind, BigInteger.valueOf(magnitude));
    }

    public static ConstantValue ofBool(boolean value) {
        return new ConstantValue(Kind.BOOL, value ? BigInteger.ONE : BigInteger.ZERO, null, 0f, 0d, null, null);
    }

    public static ConstantValue ofReal(AlgebraicReal value) {
        return new ConstantValue(Kind.REAL, null, Objects.requireNonNull(value, "Real value cannot be null"),
                0f, 0d, null, null);
    }

    public static ConstantValue ofFloat(float value) {
        return new ConstantValue(Kind.FLOAT, null, null, value, 0d, null, null);
    }

    public static ConstantValue ofDouble(double value) {
        return new ConstantValue(Kind.DOUBLE, null, null, 0f, value, null, null);
    }

    /**
     * 未解释排序的元素。若排序带有枚举，下标从枚举中解析；否则下标未知。
     */
    public static ConstantValue ofUserSort(Kind kind, String elementName) {
        if (!kind.isUninterpreted()) {
            throw new IllegalArgumentException("Not an uninterpreted sort: " + kind);
        }
        Objects.requireNonNull(elementName, "Element name cannot be null");
        Integer index = kind.getEnumeration()
                .map(elements -> elements.indexOf(elementName))
                .filter(i -> i >= 0)
                .orElse(null);
        return new ConstantValue(kind, null, null, 0f, 0d, elementName, index);
    }

    private static BigInteger normalize(Kind kind, BigInteger magnitude) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(kind.getWidth());
        BigInteger unsigned = magnitude.mod(modulus);
        if (kind.isSigned() && unsigned.testBit(kind.getWidth() - 1)) {
            return unsigned.subtract(modulus);
        }
        return unsigned;
    }

    public boolean getBoolValue() {
        return integerValue != null && integerValue.signum() != 0;
    }

    public Optional<Integer> getElementIndex() {
        return Optional.ofNullable(elementIndex);
    }

    /**
     * SMT-LIB2 字面量。未解释元素直接使用元素名。
     */
    public String toSmtLib() {
        return switch (kind.getType()) {
            case BOOL -> getBoolValue() ? "true" : "false";
            case BOUNDED -> bitVectorLiteral(integerValue, kind.getWidth());
            case UNBOUNDED -> integerValue.signum() < 0 ? "(- " + integerValue.negate() + ")" : integerValue.toString();
            case REAL -> realValue.toSmtLib();
            case FLOAT -> FloatingPoints.toTriple(floatValue);
            case DOUBLE -> FloatingPoints.toTriple(doubleValue);
            case USER_SORT -> elementName;
        };
    }

    /**
     * 宽度是 4 的倍数时用十六进制，否则用二进制。
     */
    public static String bitVectorLiteral(BigInteger value, int width) {
        BigInteger bits = value.mod(BigInteger.ONE.shiftLeft(width));
        if (width % 4 == 0) {
            return "#x" + StringUtils.leftPad(bits.toString(16), width / 4, '0');
        }
        return "#b" + StringUtils.leftPad(bits.toString(2), width, '0');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstantValue that = (ConstantValue) o;
        return kind.equals(that.kind)
                && Objects.equals(integerValue, that.integerValue)
                && Objects.equals(realValue, that.realValue)
                && Float.floatToIntBits(floatValue) == Float.floatToIntBits(that.floatValue)
                && Double.doubleToLongBits(doubleValue) == Double.doubleToLongBits(that.doubleValue)
                && Objects.equals(elementName, that.elementName)
                && Objects.equals(elementIndex, that.elementIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, integerValue, realValue, Float.floatToIntBits(floatValue),
                Double.doubleToLongBits(doubleValue), elementName, elementIndex);
    }

    @Override
    public String toString() {
        String shown = switch (kind.getType()) {
            case BOOL -> String.valueOf(getBoolValue());
            case BOUNDED, UNBOUNDED -> integerValue.toString();
            case REAL -> realValue.toString();
            case FLOAT -> String.valueOf(floatValue);
            case DOUBLE -> String.valueOf(doubleValue);
            case USER_SORT -> elementName;
        };
        return shown + " :: " + kind;
    }
}
