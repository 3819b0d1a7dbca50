package org.smtbridge.problem;

import lombok.Getter;
import org.smtbridge.core.SymRef;

import java.util.Objects;

/**
 * 程序中的一步赋值：target = expression。
 */
@Getter
public final class Assignment {

    private final SymRef target;
    private final TermExpression expression;

    private Assignment(SymRef target, TermExpression expression) {
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.expression = Objects.requireNonNull(expression, "Expression cannot be null");
    }

    public static Assignment of(SymRef target, TermExpression expression) {
        return new Assignment(target, expression);
    }

    @Override
    public String toString() {
        return target + " = " + expression;
    }
}
