package org.smtbridge.problem;

import lombok.Getter;
import org.smtbridge.core.SymRef;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个运算作用在若干符号引用上，可以带整数参数和被引用对象的名字。
 */
@Getter
public final class TermExpression {

    private final Operator operator;
    private final List<SymRef> arguments;
    private final List<Integer> parameters;
    private final String target;

    private TermExpression(Operator operator, List<SymRef> arguments, List<Integer> parameters, String target) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        this.arguments = Collections.unmodifiableList(List.copyOf(arguments));
        this.parameters = Collections.unmodifiableList(List.copyOf(parameters));
        this.target = target;
    }

    public static TermExpression of(Operator operator, SymRef... arguments) {
        return new TermExpression(operator, List.of(arguments), List.of(), null);
    }

    public static TermExpression withParameters(Operator operator, List<Integer> parameters, SymRef... arguments) {
        return new TermExpression(operator, List.of(arguments), parameters, null);
    }

    public static TermExpression onTarget(Operator operator, String target, SymRef... arguments) {
        return new TermExpression(operator, List.of(arguments), List.of(), Objects.requireNonNull(target));
    }

    public Optional<String> getTarget() {
        return Optional.ofNullable(target);
    }

    @Override
    public String toString() {
        return operator + (target == null ? "" : "[" + target + "]")
                + (parameters.isEmpty() ? "" : parameters.toString()) + arguments;
    }
}
