package org.smtbridge.problem;

import lombok.Getter;
import org.smtbridge.core.Kind;
import org.smtbridge.core.SymRef;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 自动生成的查找表：下标 i 处的值是 elements[i]。
 */
@Getter
public final class LookupTable {

    private final int id;
    private final Kind indexKind;
    private final Kind resultKind;
    private final List<SymRef> elements;

    private LookupTable(int id, Kind indexKind, Kind resultKind, List<SymRef> elements) {
        this.id = id;
        this.indexKind = Objects.requireNonNull(indexKind, "Index kind cannot be null");
        this.resultKind = Objects.requireNonNull(resultKind, "Result kind cannot be null");
        this.elements = Collections.unmodifiableList(List.copyOf(elements));
    }

    public static LookupTable of(int id, Kind indexKind, Kind resultKind, List<SymRef> elements) {
        return new LookupTable(id, indexKind, resultKind, elements);
    }

    public String getName() {
        return "table" + id;
    }
}
