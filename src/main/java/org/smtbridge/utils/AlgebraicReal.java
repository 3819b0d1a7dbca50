package org.smtbridge.utils;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 求解器返回的代数实数。三种形态：
 * <ul>
 *     <li>EXACT: 精确有理数；</li>
 *     <li>APPROXIMATE: 求解器以 "1.4142?" 形式给出的十进制近似值；</li>
 *     <li>ROOT: 整系数多项式的第 k 个根，即 {@code (root-obj p k)}。</li>
 * </ul>
 * 只有 EXACT 形态支持算术。
 */
@Getter
public final class AlgebraicReal {

    public enum RealType {
        EXACT,
        APPROXIMATE,
        ROOT
    }

    private final RealType type;
    // EXACT 与 APPROXIMATE 使用
    private final Rational value;
    // ROOT 使用：根的序号，以及 (系数, 次数) 组成的多项式
    private final int rootIndex;
    private final List<Pair<BigInteger, Integer>> polynomial;

    private AlgebraicReal(RealType type, Rational value, int rootIndex, List<Pair<BigInteger, Integer>> polynomial) {
        this.type = type;
        this.value = value;
        this.rootIndex = rootIndex;
        this.polynomial = polynomial;
    }

    public static AlgebraicReal exact(Rational value) {
        return new AlgebraicReal(RealType.EXACT, Objects.requireNonNull(value, "Value cannot be null"), 0, List.of());
    }

    public static AlgebraicReal exact(long numerator, long denominator) {
        return exact(Rational.valueOf(numerator, denominator));
    }

    /**
     * @param decimal 去掉结尾 "?" 之后的十进制串。
     */
    public static AlgebraicReal approximate(String decimal) {
        return new AlgebraicReal(RealType.APPROXIMATE, Rational.valueOf(decimal), 0, List.of());
    }

    public static AlgebraicReal root(int rootIndex, List<Pair<BigInteger, Integer>> polynomial) {
        Objects.requireNonNull(polynomial, "Polynomial cannot be null");
        if (polynomial.isEmpty()) {
            throw new IllegalArgumentException("root-obj polynomial cannot be empty");
        }
        return new AlgebraicReal(RealType.ROOT, null, rootIndex, Collections.unmodifiableList(List.copyOf(polynomial)));
    }

    public boolean isExact() {
        return type == RealType.EXACT;
    }

    public AlgebraicReal negate() {
        return switch (type) {
            case EXACT -> exact(value.negate());
            case APPROXIMATE -> new AlgebraicReal(RealType.APPROXIMATE, value.negate(), 0, List.of());
            case ROOT -> throw new ArithmeticException("Cannot negate algebraic root: " + this);
        };
    }

    public AlgebraicReal divide(AlgebraicReal other) {
        if (!this.isExact() || !other.isExact()) {
            throw new ArithmeticException("Division is only defined on exact reals: " + this + " / " + other);
        }
        return exact(value.divide(other.value));
    }

    /**
     * 可以被读回为相同值的 SMT-LIB2 文本。
     */
    public String toSmtLib() {
        return switch (type) {
            case EXACT -> value.toSmtLib();
            case APPROXIMATE -> {
                String digits = new BigDecimal(value.abs().getNumerator())
                        .divide(new BigDecimal(value.getDenominator()))
                        .toPlainString();
                if (!digits.contains(".")) {
                    digits = digits + ".0";
                }
                yield value.signum() < 0 ? "(- " + digits + "?)" : digits + "?";
            }
            case ROOT -> "(root-obj (+ "
                    + polynomial.stream().map(AlgebraicReal::renderTerm).collect(Collectors.joining(" "))
                    + ") " + rootIndex + ")";
        };
    }

    private static String renderTerm(Pair<BigInteger, Integer> term) {
        BigInteger coefficient = term.getLeft();
        int power = term.getRight();
        if (power == 0) {
            return coefficient.toString();
        }
        if (power == 1) {
            return "(* " + coefficient + " x)";
        }
        return "(* " + coefficient + " (^ x " + power + "))";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AlgebraicReal that = (AlgebraicReal) o;
        return type == that.type
                && rootIndex == that.rootIndex
                && Objects.equals(value, that.value)
                && polynomial.equals(that.polynomial);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, rootIndex, polynomial);
    }

    @Override
    public String toString() {
        return switch (type) {
            case EXACT -> value.toString();
            case APPROXIMATE -> value.doubleValue() + "...";
            case ROOT -> toSmtLib();
        };
    }
}
