package org.smtbridge.problem;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 用户给出的公理，原样写入 SMT-LIB 程序。
 */
@Getter
public final class Axiom {

    private final String name;
    private final List<String> lines;

    private Axiom(String name, List<String> lines) {
        this.name = Objects.requireNonNull(name, "Axiom name cannot be null");
        this.lines = Collections.unmodifiableList(List.copyOf(lines));
    }

    public static Axiom of(String name, List<String> lines) {
        return new Axiom(name, lines);
    }
}
