package org.smtbridge.solver;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Properties;

/**
 * 一个求解器声明支持的特性表。此表被无条件信任，不会与实际安装的求解器核对。
 * 此类是不可变的。
 */
public final class SolverCapabilities {

    private static final Logger logger = LoggerFactory.getLogger(SolverCapabilities.class);

    @Getter
    private final String solverName;
    private final boolean supportsUnboundedInts;
    private final boolean supportsReals;
    private final boolean supportsFloats;
    private final boolean supportsDoubles;
    private final boolean supportsQuantifiers;
    private final boolean supportsUninterpretedSorts;
    private final boolean supportsOptimization;

    private SolverCapabilities(String solverName, boolean supportsUnboundedInts, boolean supportsReals,
                               boolean supportsFloats, boolean supportsDoubles, boolean supportsQuantifiers,
                               boolean supportsUninterpretedSorts, boolean supportsOptimization) {
        this.solverName = Objects.requireNonNull(solverName, "Solver name cannot be null");
        this.supportsUnboundedInts = supportsUnboundedInts;
        this.supportsReals = supportsReals;
        this.supportsFloats = supportsFloats;
        this.supportsDoubles = supportsDoubles;
        this.supportsQuantifiers = supportsQuantifiers;
        this.supportsUninterpretedSorts = supportsUninterpretedSorts;
        this.supportsOptimization = supportsOptimization;
    }

    public static SolverCapabilities of(String solverName, boolean supportsUnboundedInts, boolean supportsReals,
                                        boolean supportsFloats, boolean supportsDoubles, boolean supportsQuantifiers,
                                        boolean supportsUninterpretedSorts, boolean supportsOptimization) {
        return new SolverCapabilities(solverName, supportsUnboundedInts, supportsReals, supportsFloats,
                supportsDoubles, supportsQuantifiers, supportsUninterpretedSorts, supportsOptimization);
    }

    /**
     * 什么都不支持的特性表（只剩位向量和布尔）。
     */
    public static SolverCapabilities none(String solverName) {
        return of(solverName, false, false, false, false, false, false, false);
    }

    /**
     * 从 properties 读取特性表。键：name, unboundedIntegers, reals, floats, doubles,
     * quantifiers, uninterpretedSorts, optimization。缺失的布尔键视为 false。
     * @throws IllegalArgumentException 缺少 name 时。
     */
    public static SolverCapabilities fromProperties(Properties properties) {
        String name = properties.getProperty("name");
        if (StringUtils.isBlank(name)) {
            logger.error("求解器特性表缺少 name: {}", properties);
            throw new IllegalArgumentException("Solver capability table needs a 'name' entry");
        }
        SolverCapabilities caps = of(name.trim(),
                flag(properties, "unboundedIntegers"),
                flag(properties, "reals"),
                flag(properties, "floats"),
                flag(properties, "doubles"),
                flag(properties, "quantifiers"),
                flag(properties, "uninterpretedSorts"),
                flag(properties, "optimization"));
        logger.debug("从 properties 读取求解器特性表: {}", caps);
        return caps;
    }

    private static boolean flag(Properties properties, String key) {
        return Boolean.parseBoolean(StringUtils.trim(properties.getProperty(key, "false")));
    }

    public boolean supportsUnboundedInts() {
        return supportsUnboundedInts;
    }

    public boolean supportsReals() {
        return supportsReals;
    }

    public boolean supportsFloats() {
        return supportsFloats;
    }

    public boolean supportsDoubles() {
        return supportsDoubles;
    }

    public boolean supportsQuantifiers() {
        return supportsQuantifiers;
    }

    public boolean supportsUninterpretedSorts() {
        return supportsUninterpretedSorts;
    }

    public boolean supportsOptimization() {
        return supportsOptimization;
    }

    public SolverCapabilities withOptimization(boolean value) {
        return of(solverName, supportsUnboundedInts, supportsReals, supportsFloats, supportsDoubles,
                supportsQuantifiers, supportsUninterpretedSorts, value);
    }

    public SolverCapabilities withQuantifiers(boolean value) {
        return of(solverName, supportsUnboundedInts, supportsReals, supportsFloats, supportsDoubles,
                value, supportsUninterpretedSorts, supportsOptimization);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SolverCapabilities that = (SolverCapabilities) o;
        return supportsUnboundedInts == that.supportsUnboundedInts
                && supportsReals == that.supportsReals
                && supportsFloats == that.supportsFloats
                && supportsDoubles == that.supportsDoubles
                && supportsQuantifiers == that.supportsQuantifiers
                && supportsUninterpretedSorts == that.supportsUninterpretedSorts
                && supportsOptimization == that.supportsOptimization
                && solverName.equals(that.solverName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(solverName, supportsUnboundedInts, supportsReals, supportsFloats, supportsDoubles,
                supportsQuantifiers, supportsUninterpretedSorts, supportsOptimization);
    }

    @Override
    public String toString() {
        return solverName + "{ints=" + supportsUnboundedInts + ", reals=" + supportsReals
                + ", floats=" + supportsFloats + ", doubles=" + supportsDoubles
                + ", quantifiers=" + supportsQuantifiers + ", sorts=" + supportsUninterpretedSorts
                + ", optimization=" + supportsOptimization + "}";
    }
}
