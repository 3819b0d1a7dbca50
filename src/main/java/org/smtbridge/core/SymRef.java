package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 符号引用：问题中一个已分配的符号值，由节点 id 标识并携带其 Kind。
 * 打印形式为 "s" + id，与求解器输出中的名字一致。
 */
@Getter
public final class SymRef implements Comparable<SymRef> {

    // 保留的两个布尔常量节点
    public static final SymRef FALSE_REF = new SymRef(-2, Kind.BOOL);
    public static final SymRef TRUE_REF = new SymRef(-1, Kind.BOOL);

    private final int id;
    private final Kind kind;

    private SymRef(int id, Kind kind) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
    }

    public static SymRef of(int id, Kind kind) {
        if (id == FALSE_REF.id) {
            return FALSE_REF;
        }
        if (id == TRUE_REF.id) {
            return TRUE_REF;
        }
        return new SymRef(id, kind);
    }

    public String getName() {
        return "s" + id;
    }

    @Override
    public int compareTo(SymRef other) {
        return Integer.compare(this.id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymRef that = (SymRef) o;
        return id == that.id && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return getName();
    }
}
