package org.smtbridge.problem;

import lombok.Getter;
import org.smtbridge.core.SymRef;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 斯科伦化后的一个输入：全称变量本身，或依赖于其前面全称变量的存在变量。
 */
@Getter
public final class SkolemEntry {

    private final SymRef ref;
    private final boolean universal;
    // 存在变量依赖的全称变量，按出现顺序
    private final List<SymRef> dependencies;

    private SkolemEntry(SymRef ref, boolean universal, List<SymRef> dependencies) {
        this.ref = Objects.requireNonNull(ref, "SymRef cannot be null");
        this.universal = universal;
        this.dependencies = Collections.unmodifiableList(List.copyOf(dependencies));
    }

    public static SkolemEntry universal(SymRef ref) {
        return new SkolemEntry(ref, true, List.of());
    }

    public static SkolemEntry existential(SymRef ref, List<SymRef> dependencies) {
        return new SkolemEntry(ref, false, dependencies);
    }

    /**
     * 不依赖任何全称变量的存在变量，它的值可以直接从模型中读取。
     */
    public boolean isTopLevel() {
        return !universal && dependencies.isEmpty();
    }

    @Override
    public String toString() {
        return universal ? "forall " + ref : ref + dependencies.toString();
    }
}
