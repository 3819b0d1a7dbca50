package org.smtbridge.result;

import lombok.Getter;
import org.smtbridge.solver.SmtConfig;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 分类后的求解结果。SATISFIABLE / UNKNOWN 带模型，PROOF_ERROR 带原始回复。
 */
@Getter
public final class SmtResult {

    private final ResultType type;
    private final SmtConfig config;
    private final SmtModel model;
    private final List<String> rawLines;

    private SmtResult(ResultType type, SmtConfig config, SmtModel model, List<String> rawLines) {
        this.type = type;
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.model = model;
        this.rawLines = List.copyOf(rawLines);
    }

    public static SmtResult unsatisfiable(SmtConfig config) {
        return new SmtResult(ResultType.UNSATISFIABLE, config, null, List.of());
    }

    public static SmtResult unknown(SmtConfig config, SmtModel model) {
        return new SmtResult(ResultType.UNKNOWN, config, Objects.requireNonNull(model), List.of());
    }

    public static SmtResult satisfiable(SmtConfig config, SmtModel model) {
        return new SmtResult(ResultType.SATISFIABLE, config, Objects.requireNonNull(model), List.of());
    }

    public static SmtResult timeout(SmtConfig config) {
        return new SmtResult(ResultType.TIMEOUT, config, null, List.of());
    }

    public static SmtResult proofError(SmtConfig config, List<String> rawLines) {
        return new SmtResult(ResultType.PROOF_ERROR, config, null, rawLines);
    }

    public Optional<SmtModel> getModel() {
        return Optional.ofNullable(model);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SmtResult that = (SmtResult) o;
        return type == that.type && config.equals(that.config)
                && Objects.equals(model, that.model) && rawLines.equals(that.rawLines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, config, model, rawLines);
    }

    @Override
    public String toString() {
        return switch (type) {
            case UNSATISFIABLE -> "Unsatisfiable";
            case UNKNOWN -> "Unknown. Potential model: " + model;
            case SATISFIABLE -> "Satisfiable. Model: " + model;
            case TIMEOUT -> "Timeout (" + config.getSolverName() + ")";
            case PROOF_ERROR -> "Unrecognized reply from " + config.getSolverName() + ": " + String.join("\n", rawLines);
        };
    }
}
