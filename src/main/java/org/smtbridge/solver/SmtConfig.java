package org.smtbridge.solver;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 一次求解所用的配置：特性表、check-sat 命令、可选的 logic。
 */
@Getter
public final class SmtConfig {

    public static final String DEFAULT_SAT_COMMAND = "(check-sat)";

    private final SolverCapabilities capabilities;
    private final String satCommand;
    private final String logic;

    private SmtConfig(SolverCapabilities capabilities, String satCommand, String logic) {
        this.capabilities = Objects.requireNonNull(capabilities, "Capabilities cannot be null");
        this.satCommand = Objects.requireNonNull(satCommand, "Sat command cannot be null");
        this.logic = logic;
    }

    public static SmtConfig of(SolverCapabilities capabilities) {
        return new SmtConfig(capabilities, DEFAULT_SAT_COMMAND, null);
    }

    public static SmtConfig of(KnownSolver solver) {
        return of(solver.getCapabilities());
    }

    public SmtConfig withSatCommand(String satCommand) {
        return new SmtConfig(capabilities, satCommand, logic);
    }

    public SmtConfig withLogic(String logic) {
        return new SmtConfig(capabilities, satCommand, logic);
    }

    public Optional<String> getLogic() {
        return Optional.ofNullable(logic);
    }

    public String getSolverName() {
        return capabilities.getSolverName();
    }

    @Override
    public String toString() {
        return "SmtConfig{" + capabilities.getSolverName() + ", " + satCommand
                + (logic == null ? "" : ", logic=" + logic) + "}";
    }
}
