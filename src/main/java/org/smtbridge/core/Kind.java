package org.smtbridge.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 代表一个值的逻辑排序（sort）。
 * 此类是不可变的，按结构相等比较。
 */
@Getter
public final class Kind {

    private static final Logger logger = LoggerFactory.getLogger(Kind.class);

    public static final Kind BOOL = new Kind(KindType.BOOL, false, 1, null, null);
    public static final Kind UNBOUNDED = new Kind(KindType.UNBOUNDED, true, 0, null, null);
    public static final Kind REAL = new Kind(KindType.REAL, true, 0, null, null);
    public static final Kind FLOAT = new Kind(KindType.FLOAT, true, 32, null, null);
    public static final Kind DOUBLE = new Kind(KindType.DOUBLE, true, 64, null, null);

    private final KindType type;
    private final boolean signed;
    private final int width;
    private final String sortName;
    // null 表示该排序没有显式枚举
    private final List<String> enumeration;

    private final int hashCode;

    private Kind(KindType type, boolean signed, int width, String sortName, List<String> enumeration) {
        this.type = type;
        this.signed = signed;
        this.width = width;
        this.sortName = sortName;
        this.enumeration = enumeration == null ? null : Collections.unmodifiableList(List.copyOf(enumeration));
        this.hashCode = Objects.hash(type, signed, width, sortName, this.enumeration);
    }

    /**
     * 工厂方法：定宽位向量。
     * @param signed 是否带符号。
     * @param width 位宽，必须为正。
     */
    public static Kind bounded(boolean signed, int width) {
        if (width <= 0) {
            logger.error("位向量宽度非法: {}", width);
            throw new IllegalArgumentException("Bit-vector width must be positive: " + width);
        }
        return new Kind(KindType.BOUNDED, signed, width, null, null);
    }

    public static Kind unsigned(int width) {
        return bounded(false, width);
    }

    public static Kind signed(int width) {
        return bounded(true, width);
    }

    /**
     * 工厂方法：没有显式枚举的未解释排序。
     */
    public static Kind userSort(String name) {
        Objects.requireNonNull(name, "Sort name cannot be null");
        return new Kind(KindType.USER_SORT, false, 0, name, null);
    }

    /**
     * 工厂方法：带有有限枚举元素的未解释排序。
     * @param name 排序名。
     * @param elements 按顺序排列的元素名，元素的下标即其枚举索引。
     */
    public static Kind userSort(String name, List<String> elements) {
        Objects.requireNonNull(name, "Sort name cannot be null");
        Objects.requireNonNull(elements, "Sort elements cannot be null");
        return new Kind(KindType.USER_SORT, false, 0, name, elements);
    }

    public Optional<List<String>> getEnumeration() {
        return Optional.ofNullable(enumeration);
    }

    public boolean isBoolean() {
        return type == KindType.BOOL;
    }

    public boolean isBounded() {
        return type == KindType.BOUNDED;
    }

    /**
     * 无界整数。
     */
    public boolean isUnbounded() {
        return type == KindType.UNBOUNDED;
    }

    public boolean isReal() {
        return type == KindType.REAL;
    }

    public boolean isFloat() {
        return type == KindType.FLOAT;
    }

    public boolean isDouble() {
        return type == KindType.DOUBLE;
    }

    public boolean isUninterpreted() {
        return type == KindType.USER_SORT;
    }

    /**
     * 可以直接承载整数字面量的排序：布尔、位向量、无界整数。
     */
    public boolean isIntegral() {
        return type == KindType.BOOL || type == KindType.BOUNDED || type == KindType.UNBOUNDED;
    }

    /**
     * 对应的 SMT-LIB2 排序写法。
     */
    public String toSmtLib() {
        return switch (type) {
            case BOOL -> "Bool";
            case BOUNDED -> "(_ BitVec " + width + ")";
            case UNBOUNDED -> "Int";
            case REAL -> "Real";
            case FLOAT -> "(_ FloatingPoint 8 24)";
            case DOUBLE -> "(_ FloatingPoint 11 53)";
            case USER_SORT -> sortName;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Kind kind = (Kind) o;
        return type == kind.type
                && signed == kind.signed
                && width == kind.width
                && Objects.equals(sortName, kind.sortName)
                && Objects.equals(enumeration, kind.enumeration);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (type) {
            case BOOL -> "SBool";
            case BOUNDED -> (signed ? "SInt" : "SWord") + width;
            case UNBOUNDED -> "SInteger";
            case REAL -> "SReal";
            case FLOAT -> "SFloat";
            case DOUBLE -> "SDouble";
            case USER_SORT -> sortName;
        };
    }
}
