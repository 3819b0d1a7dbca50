package org.smtbridge.result;

/**
 * 一次求解的结论。
 */
public enum ResultType {
    UNSATISFIABLE,
    UNKNOWN,
    SATISFIABLE,
    TIMEOUT,
    // 无法识别的回复，保留原始文本
    PROOF_ERROR
}
