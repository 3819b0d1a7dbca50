package org.smtbridge.smtlib;

import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymRef;
import org.smtbridge.problem.CaseCondition;
import org.smtbridge.problem.Objective;
import org.smtbridge.problem.ProblemDescriptor;
import org.smtbridge.solver.SolverCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 编码前的特性检查。
 * 各项特性按固定顺序检查，第一个失败的立即报告；
 * 之后的"对全称变量做优化"检查则收集所有违规目标的名字一起报告。
 */
public final class CapabilityGate {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityGate.class);

    private CapabilityGate() {
    }

    /**
     * @throws UnsupportedFeatureException 问题需要求解器不支持的特性时。
     */
    public static void check(ProblemDescriptor problem) {
        check(problem.getKinds(), problem.isSat(), problem.getInputs(), problem.getCaseCondition(),
                problem.getConfig().getCapabilities());
    }

    /**
     * @param kinds 问题中实际出现的 Kind。
     * @param isSat true 表示求可满足性，false 表示证明。
     * @param inputs 带量词的输入。
     * @param caseCondition 优化指令。
     * @param caps 求解器特性表。
     * @throws UnsupportedFeatureException 问题需要求解器不支持的特性时。
     */
    public static void check(Set<Kind> kinds, boolean isSat, List<NamedSymVar> inputs,
                             CaseCondition caseCondition, SolverCapabilities caps) {
        boolean needsUnbounded = kinds.stream().anyMatch(Kind::isUnbounded);
        boolean needsReals = kinds.stream().anyMatch(Kind::isReal);
        boolean needsFloats = kinds.stream().anyMatch(Kind::isFloat);
        boolean needsDoubles = kinds.stream().anyMatch(Kind::isDouble);
        boolean needsSorts = kinds.stream().anyMatch(Kind::isUninterpreted);
        boolean needsOptimization = caseCondition.isOptimization();
        // 求可满足性时全称变量需要量词；证明时（整体取反）存在变量需要量词
        Quantifier offending = isSat ? Quantifier.ALL : Quantifier.EX;
        boolean needsQuantifiers = inputs.stream().anyMatch(i -> i.getQuantifier() == offending);

        if (needsUnbounded && !caps.supportsUnboundedInts()) {
            throw unsupported("unbounded integers", caps);
        }
        if (needsReals && !caps.supportsReals()) {
            throw unsupported("algebraic reals", caps);
        }
        if (needsFloats && !caps.supportsFloats()) {
            throw unsupported("single-precision floating-point numbers", caps);
        }
        if (needsDoubles && !caps.supportsDoubles()) {
            throw unsupported("double-precision floating-point numbers", caps);
        }
        if (needsQuantifiers && !caps.supportsQuantifiers()) {
            throw unsupported("quantifiers", caps);
        }
        if (needsSorts && !caps.supportsUninterpretedSorts()) {
            throw unsupported("uninterpreted sorts", caps);
        }
        if (needsOptimization && !caps.supportsOptimization()) {
            throw unsupported("optimization routines", caps);
        }

        if (needsOptimization) {
            Set<SymRef> universals = inputs.stream()
                    .filter(NamedSymVar::isUniversal)
                    .map(NamedSymVar::getRef)
                    .collect(Collectors.toSet());
            List<String> universalObjectives = caseCondition.getObjectives().stream()
                    .filter(o -> universals.stream().anyMatch(o::mentions))
                    .map(Objective::getName)
                    .collect(Collectors.toList());
            if (!universalObjectives.isEmpty()) {
                String feature = "optimization of universally quantified metric(s): " + String.join(" ", universalObjectives);
                logger.error("问题需要 {}，无法编码", feature);
                throw new UnsupportedFeatureException(feature,
                        "Given problem needs " + feature + "\n*** Which is not supported.");
            }
        }
        logger.debug("特性检查通过: {} 种 Kind，求解器 {}", kinds.size(), caps.getSolverName());
    }

    private static UnsupportedFeatureException unsupported(String feature, SolverCapabilities caps) {
        logger.error("问题需要 {}，但求解器 {} 不支持", feature, caps.getSolverName());
        return new UnsupportedFeatureException(feature, "Given problem needs " + feature
                + "\n*** Which is not supported for the chosen solver: " + caps.getSolverName());
    }
}
