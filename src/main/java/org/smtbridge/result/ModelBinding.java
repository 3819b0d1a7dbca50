package org.smtbridge.result;

import lombok.Getter;

import java.util.Objects;

/**
 * 从一行求解器输出中得到的一个绑定：引用 id、输入名、值。
 * @param <V> {@link org.smtbridge.core.ConstantValue} 或 {@link org.smtbridge.core.GeneralizedConstantValue}
 */
@Getter
public final class ModelBinding<V> {

    private final int refId;
    private final String name;
    private final V value;

    private ModelBinding(int refId, String name, V value) {
        this.refId = refId;
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
    }

    public static <V> ModelBinding<V> of(int refId, String name, V value) {
        return new ModelBinding<>(refId, name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelBinding<?> that = (ModelBinding<?>) o;
        return refId == that.refId && name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(refId, name, value);
    }

    @Override
    public String toString() {
        return name + " = " + value;
    }
}
