package org.smtbridge.smtlib;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.problem.ProblemDescriptor;

/**
 * 把已经通过特性检查的问题转换为某一协议版本的 (preamble, postlude) 文本。
 */
public interface SmtLibConverter {

    /**
     * @param problem 已经通过 {@link CapabilityGate} 的问题。
     * @return 左边是 preamble，右边是 postlude。
     */
    Pair<String, String> convert(ProblemDescriptor problem);
}
