package org.smtbridge.smtlib;

import lombok.Getter;

import java.util.Objects;

/**
 * 交给求解器调用层的产物：先发送 preamble，再发送 check-sat，
 * 结果为 sat/unknown 时再发送 postlude 取回模型或目标值。
 */
@Getter
public final class SmtLibProgram {

    private final SmtLibVersion version;
    private final String preamble;
    private final String postlude;

    private SmtLibProgram(SmtLibVersion version, String preamble, String postlude) {
        this.version = Objects.requireNonNull(version, "Version cannot be null");
        this.preamble = Objects.requireNonNull(preamble, "Preamble cannot be null");
        this.postlude = Objects.requireNonNull(postlude, "Postlude cannot be null");
    }

    public static SmtLibProgram of(SmtLibVersion version, String preamble, String postlude) {
        return new SmtLibProgram(version, preamble, postlude);
    }

    @Override
    public String toString() {
        return preamble + "\n" + postlude;
    }
}
