package org.smtbridge.smtlib;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.problem.ProblemDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 编码入口：先做特性检查，再按协议版本分派给对应的 {@link SmtLibConverter}。
 */
public final class SmtLibTranslator {

    private static final Logger logger = LoggerFactory.getLogger(SmtLibTranslator.class);

    private static final SmtLibConverter SMTLIB2_CONVERTER = new SmtLib2Converter();

    private SmtLibTranslator() {
    }

    /**
     * @param version 目标协议版本。
     * @param problem 待编码的问题，不会被修改。
     * @return 带版本标签的 (preamble, postlude)。
     * @throws UnsupportedFeatureException 特性检查失败时，此时不会生成任何文本。
     */
    public static SmtLibProgram toSmtLib(SmtLibVersion version, ProblemDescriptor problem) {
        CapabilityGate.check(problem);
        SmtLibConverter converter = switch (version) {
            case SMTLIB2 -> SMTLIB2_CONVERTER;
        };
        Pair<String, String> text = converter.convert(problem);
        logger.info("问题已编码为 {}，求解器: {}，输入 {} 个", version, problem.getConfig().getSolverName(),
                problem.getInputs().size());
        return SmtLibProgram.of(version, text.getLeft(), text.getRight());
    }
}
