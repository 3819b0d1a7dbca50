package org.smtbridge.problem;

/**
 * 多目标优化时目标之间的关系，对应 z3 的 :opt.priority 选项。
 */
public enum OptimizeStyle {
    LEXICOGRAPHIC("lex"),
    INDEPENDENT("box"),
    PARETO("pareto");

    private final String priority;

    OptimizeStyle(String priority) {
        this.priority = priority;
    }

    public String getPriority() {
        return priority;
    }
}
