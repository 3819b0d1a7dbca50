package org.smtbridge.problem;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.SymRef;

import java.util.Objects;

/**
 * 一个优化目标。操作数对为 (目标变量, 被优化的表达式)，编码时两者被约束为相等。
 */
@Getter
public final class Objective {

    public enum Direction {
        MAXIMIZE("maximize"),
        MINIMIZE("minimize");

        private final String command;

        Direction(String command) {
            this.command = command;
        }

        public String getCommand() {
            return command;
        }
    }

    private final Direction direction;
    private final String name;
    private final Pair<SymRef, SymRef> operands;

    private Objective(Direction direction, String name, Pair<SymRef, SymRef> operands) {
        this.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        this.name = Objects.requireNonNull(name, "Objective name cannot be null");
        this.operands = Objects.requireNonNull(operands, "Operands cannot be null");
    }

    public static Objective maximize(String name, SymRef variable, SymRef expression) {
        return new Objective(Direction.MAXIMIZE, name, Pair.of(variable, expression));
    }

    public static Objective minimize(String name, SymRef variable, SymRef expression) {
        return new Objective(Direction.MINIMIZE, name, Pair.of(variable, expression));
    }

    public boolean mentions(SymRef ref) {
        return operands.getLeft().equals(ref) || operands.getRight().equals(ref);
    }

    @Override
    public String toString() {
        return direction.getCommand() + " " + name + " " + operands;
    }
}
