package org.smtbridge.problem;

import lombok.Getter;
import org.smtbridge.core.Kind;
import org.smtbridge.core.SymRef;

import java.util.Objects;
import java.util.Optional;

/**
 * 用户声明的数组。可选的初始元素表示所有下标都取这个值。
 */
@Getter
public final class ArrayInfo {

    private final int id;
    private final String userName;
    private final Kind indexKind;
    private final Kind elementKind;
    private final SymRef initialElement;

    private ArrayInfo(int id, String userName, Kind indexKind, Kind elementKind, SymRef initialElement) {
        this.id = id;
        this.userName = Objects.requireNonNull(userName, "Array name cannot be null");
        this.indexKind = Objects.requireNonNull(indexKind, "Index kind cannot be null");
        this.elementKind = Objects.requireNonNull(elementKind, "Element kind cannot be null");
        this.initialElement = initialElement;
    }

    public static ArrayInfo of(int id, String userName, Kind indexKind, Kind elementKind) {
        return new ArrayInfo(id, userName, indexKind, elementKind, null);
    }

    public static ArrayInfo of(int id, String userName, Kind indexKind, Kind elementKind, SymRef initialElement) {
        return new ArrayInfo(id, userName, indexKind, elementKind, Objects.requireNonNull(initialElement));
    }

    public Optional<SymRef> getInitialElement() {
        return Optional.ofNullable(initialElement);
    }

    public String getName() {
        return "array_" + id;
    }

    public String getSort() {
        return "(Array " + indexKind.toSmtLib() + " " + elementKind.toSmtLib() + ")";
    }
}
