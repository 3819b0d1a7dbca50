package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 问题的一个输入：符号引用 + 用户可见的名字 + 量词极性。
 */
@Getter
public final class NamedSymVar {

    private final SymRef ref;
    private final String name;
    private final Quantifier quantifier;

    private NamedSymVar(SymRef ref, String name, Quantifier quantifier) {
        this.ref = Objects.requireNonNull(ref, "SymRef cannot be null");
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.quantifier = Objects.requireNonNull(quantifier, "Quantifier cannot be null");
    }

    public static NamedSymVar of(SymRef ref, String name, Quantifier quantifier) {
        return new NamedSymVar(ref, name, quantifier);
    }

    public static NamedSymVar exists(SymRef ref, String name) {
        return new NamedSymVar(ref, name, Quantifier.EX);
    }

    public static NamedSymVar forall(SymRef ref, String name) {
        return new NamedSymVar(ref, name, Quantifier.ALL);
    }

    public boolean isUniversal() {
        return quantifier == Quantifier.ALL;
    }

    public Kind getKind() {
        return ref.getKind();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NamedSymVar that = (NamedSymVar) o;
        return ref.equals(that.ref) && name.equals(that.name) && quantifier == that.quantifier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, name, quantifier);
    }

    @Override
    public String toString() {
        return "(" + ref + ", " + name + ")";
    }
}
