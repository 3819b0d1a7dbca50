package org.smtbridge.problem;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 分情况/优化指令。当前只有两种：无，或一组最大化/最小化目标。
 */
@Getter
public final class CaseCondition {

    private static final CaseCondition NONE = new CaseCondition(false, OptimizeStyle.LEXICOGRAPHIC, List.of());

    private final boolean optimization;
    private final OptimizeStyle style;
    private final List<Objective> objectives;

    private CaseCondition(boolean optimization, OptimizeStyle style, List<Objective> objectives) {
        this.optimization = optimization;
        this.style = Objects.requireNonNull(style, "Style cannot be null");
        this.objectives = Collections.unmodifiableList(List.copyOf(objectives));
    }

    public static CaseCondition none() {
        return NONE;
    }

    public static CaseCondition optimize(OptimizeStyle style, List<Objective> objectives) {
        return new CaseCondition(true, style, objectives);
    }

    @Override
    public String toString() {
        return optimization ? "Opt " + style + " " + objectives : "NoCase";
    }
}
