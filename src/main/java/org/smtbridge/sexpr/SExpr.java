package org.smtbridge.sexpr;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.smtbridge.utils.AlgebraicReal;
import org.smtbridge.utils.FloatingPoints;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 求解器输出的通用 S 表达式树：原子（符号、整数、实数、浮点）或应用（子树列表）。
 * 所有节点都是不可变的，按结构相等比较。
 * {@link #toString()} 的结果可以被 {@link SExprParser} 读回为结构相等的树。
 */
public abstract class SExpr {

    private SExpr() {
    }

    public static Symbol sym(String name) {
        return new Symbol(name);
    }

    public static Num num(long value) {
        return new Num(BigInteger.valueOf(value), null);
    }

    public static Num num(BigInteger value, Integer width) {
        return new Num(value, width);
    }

    public static RealNum real(AlgebraicReal value) {
        return new RealNum(value);
    }

    public static FloatNum flt(float value) {
        return new FloatNum(value);
    }

    public static DoubleNum dbl(double value) {
        return new DoubleNum(value);
    }

    public static App app(SExpr... items) {
        return new App(Arrays.asList(items));
    }

    public static App app(List<SExpr> items) {
        return new App(items);
    }

    /**
     * 是否为名字恰好是 name 的符号。
     */
    public boolean isSymbol(String name) {
        return this instanceof Symbol s && s.getName().equals(name);
    }

    /**
     * 是否为值恰好是 value 的整数。
     */
    public boolean isNum(long value) {
        return this instanceof Num n && n.getValue().equals(BigInteger.valueOf(value));
    }

    /**
     * 若此节点是应用，返回其子树列表。
     */
    public Optional<List<SExpr>> asApp() {
        return this instanceof App a ? Optional.of(a.getItems()) : Optional.empty();
    }

    @Getter
    public static final class Symbol extends SExpr {
        private final String name;

        private Symbol(String name) {
            this.name = Objects.requireNonNull(name, "Symbol name cannot be null");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Symbol that && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * 整数字面量。width 为位宽（来自 #b/#x 字面量），未知时为 null。
     */
    @Getter
    public static final class Num extends SExpr {
        private final BigInteger value;
        private final Integer width;

        private Num(BigInteger value, Integer width) {
            this.value = Objects.requireNonNull(value, "Value cannot be null");
            this.width = width;
        }

        public Optional<Integer> getWidth() {
            return Optional.ofNullable(width);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Num that && value.equals(that.value) && Objects.equals(width, that.width);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, width);
        }

        @Override
        public String toString() {
            if (width == null) {
                return value.toString();
            }
            String bits = "#b" + StringUtils.leftPad(value.abs().toString(2), width, '0');
            return value.signum() < 0 ? "(- " + bits + ")" : bits;
        }
    }

    @Getter
    public static final class RealNum extends SExpr {
        private final AlgebraicReal value;

        private RealNum(AlgebraicReal value) {
            this.value = Objects.requireNonNull(value, "Value cannot be null");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RealNum that && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toSmtLib();
        }
    }

    /**
     * 单精度浮点值，由位模式字面量得到。
     */
    @Getter
    public static final class FloatNum extends SExpr {
        private final float value;

        private FloatNum(float value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FloatNum that && Float.floatToIntBits(value) == Float.floatToIntBits(that.value);
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }

        @Override
        public String toString() {
            return FloatingPoints.toTriple(value);
        }
    }

    @Getter
    public static final class DoubleNum extends SExpr {
        private final double value;

        private DoubleNum(double value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DoubleNum that && Double.doubleToLongBits(value) == Double.doubleToLongBits(that.value);
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return FloatingPoints.toTriple(value);
        }
    }

    /**
     * 应用：括号中的子树列表，可以为空。
     */
    @Getter
    public static final class App extends SExpr {
        private final List<SExpr> items;

        private App(List<SExpr> items) {
            this.items = Collections.unmodifiableList(List.copyOf(items));
        }

        public int size() {
            return items.size();
        }

        public SExpr get(int i) {
            return items.get(i);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        /**
         * 首个子树，空应用返回 empty。
         */
        public Optional<SExpr> head() {
            return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof App that && items.equals(that.items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.stream().map(SExpr::toString).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
