package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 优化目标的取值：普通常量，或带 Kind 标签的正负无穷、正负无穷小。
 */
@Getter
public final class GeneralizedConstantValue {

    public enum GeneralizedType {
        REGULAR,
        INFINITE,
        EPSILON
    }

    private final GeneralizedType type;
    private final Kind kind;
    private final ConstantValue value;
    private final boolean negative;

    private GeneralizedConstantValue(GeneralizedType type, Kind kind, ConstantValue value, boolean negative) {
        this.type = type;
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.value = value;
        this.negative = negative;
    }

    public static GeneralizedConstantValue regular(ConstantValue value) {
        Objects.requireNonNull(value, "Value cannot be null");
        return new GeneralizedConstantValue(GeneralizedType.REGULAR, value.getKind(), value, false);
    }

    public static GeneralizedConstantValue infinite(Kind kind, boolean negative) {
        return new GeneralizedConstantValue(GeneralizedType.INFINITE, kind, null, negative);
    }

    public static GeneralizedConstantValue epsilon(Kind kind, boolean negative) {
        return new GeneralizedConstantValue(GeneralizedType.EPSILON, kind, null, negative);
    }

    public Optional<ConstantValue> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isRegular() {
        return type == GeneralizedType.REGULAR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GeneralizedConstantValue that = (GeneralizedConstantValue) o;
        return type == that.type && negative == that.negative
                && kind.equals(that.kind) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, kind, value, negative);
    }

    @Override
    public String toString() {
        return switch (type) {
            case REGULAR -> value.toString();
            case INFINITE -> (negative ? "-oo" : "oo") + " :: " + kind;
            case EPSILON -> (negative ? "-epsilon" : "epsilon") + " :: " + kind;
        };
    }
}
