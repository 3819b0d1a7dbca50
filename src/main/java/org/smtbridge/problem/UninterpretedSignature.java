package org.smtbridge.problem;

import lombok.Getter;
import org.smtbridge.core.Kind;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 未解释函数或常量（参数列表为空）的签名。
 */
@Getter
public final class UninterpretedSignature {

    private final String name;
    private final List<Kind> argumentKinds;
    private final Kind resultKind;

    private UninterpretedSignature(String name, List<Kind> argumentKinds, Kind resultKind) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.argumentKinds = Collections.unmodifiableList(List.copyOf(argumentKinds));
        this.resultKind = Objects.requireNonNull(resultKind, "Result kind cannot be null");
    }

    public static UninterpretedSignature function(String name, List<Kind> argumentKinds, Kind resultKind) {
        return new UninterpretedSignature(name, argumentKinds, resultKind);
    }

    public static UninterpretedSignature constant(String name, Kind kind) {
        return new UninterpretedSignature(name, List.of(), kind);
    }
}
