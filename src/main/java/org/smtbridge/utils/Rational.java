package org.smtbridge.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确的有理数，分子分母均为 BigInteger。
 * 始终保持规范形式：分母为正，分子分母互素。
 * 求解器模型里的实数值最终都落到这里。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ZERO = BigInteger.ZERO;
    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BIG_INT_ZERO, BIG_INT_ONE);
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);
    public static final Rational MINUS_ONE = new Rational(BIG_INT_ONE.negate(), BIG_INT_ONE);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(MINUS_ONE.getCacheKey(), MINUS_ONE);
        for (int i = -16; i <= 16; i++) {
            valueOf(i);
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Numerator cannot be null");
        Objects.requireNonNull(denominator, "Denominator cannot be null");

        if (denominator.signum() == 0) {
            logger.error("分母为零: {} / 0", numerator);
            throw new ArithmeticException("Rational with zero denominator: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析十进制小数（"12.375"）或分数（"3/4"）形式的字符串。
     * @throws NumberFormatException 格式非法时。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("Empty rational literal");
        }
        s = s.trim();

        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("Invalid fraction: " + s);
            }
            BigInteger den = new BigInteger(parts[1].trim());
            if (den.signum() == 0) {
                throw new NumberFormatException("Zero denominator in fraction: " + s);
            }
            return valueOf(new BigInteger(parts[0].trim()), den);
        }

        BigDecimal bd;
        try {
            bd = new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Invalid decimal literal: " + s);
        }
        int scale = bd.scale();
        if (scale <= 0) {
            return valueOf(bd.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)), BIG_INT_ONE);
        }
        return valueOf(bd.unscaledValue(), BIG_INT_TEN.pow(scale));
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this == ZERO) {
            return other;
        }
        if (other == ZERO) {
            return this;
        }
        return valueOf(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException 除数为零时。
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("尝试计算 {} / 0", this);
            throw new ArithmeticException("Division by zero: " + this + " / 0");
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public Rational abs() {
        return signum() >= 0 ? this : negate();
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    public double doubleValue() {
        if (isInteger()) {
            return numerator.doubleValue();
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), java.math.MathContext.DECIMAL128).doubleValue();
    }

    /**
     * SMT-LIB2 实数字面量：整数写作 "n.0"，分数写作 "(/ p.0 q.0)"，负数外面包一层 "(- ...)"。
     */
    public String toSmtLib() {
        Rational magnitude = abs();
        String body = magnitude.isInteger()
                ? magnitude.numerator + ".0"
                : "(/ " + magnitude.numerator + ".0 " + magnitude.denominator + ".0)";
        return signum() < 0 ? "(- " + body + ")" : body;
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    /**
     * 只缓存足够小的值。
     */
    private static boolean shouldCache(Rational r) {
        return r.numerator.abs().bitLength() + r.denominator.bitLength() < 64;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
