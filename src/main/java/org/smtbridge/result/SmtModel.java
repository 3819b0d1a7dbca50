package org.smtbridge.result;

import lombok.Getter;
import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.GeneralizedConstantValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 求解器给出的模型：输入名到常量的有序映射，以及优化目标名到广义常量的有序映射。
 */
@Getter
public final class SmtModel {

    private static final SmtModel EMPTY = new SmtModel(Map.of(), Map.of());

    private final Map<String, ConstantValue> assignments;
    private final Map<String, GeneralizedConstantValue> objectives;

    private SmtModel(Map<String, ConstantValue> assignments, Map<String, GeneralizedConstantValue> objectives) {
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        this.objectives = Collections.unmodifiableMap(new LinkedHashMap<>(objectives));
    }

    /**
     * @param assignments 按引用 id 排好序的绑定；迭代顺序会被保留。
     * @param objectives 同上。
     */
    public static SmtModel of(Map<String, ConstantValue> assignments, Map<String, GeneralizedConstantValue> objectives) {
        Objects.requireNonNull(assignments, "Assignments cannot be null");
        Objects.requireNonNull(objectives, "Objectives cannot be null");
        return new SmtModel(assignments, objectives);
    }

    public static SmtModel empty() {
        return EMPTY;
    }

    public Optional<ConstantValue> getValue(String name) {
        return Optional.ofNullable(assignments.get(name));
    }

    public Optional<GeneralizedConstantValue> getObjective(String name) {
        return Optional.ofNullable(objectives.get(name));
    }

    public boolean isEmpty() {
        return assignments.isEmpty() && objectives.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SmtModel that = (SmtModel) o;
        return assignments.equals(that.assignments) && objectives.equals(that.objectives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignments, objectives);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        assignments.forEach((name, value) -> sb.append("\n  ").append(name).append(" = ").append(value));
        objectives.forEach((name, value) -> sb.append("\n  ").append(name).append(" -> ").append(value));
        return sb.append(assignments.isEmpty() && objectives.isEmpty() ? "}" : "\n}").toString();
    }
}
