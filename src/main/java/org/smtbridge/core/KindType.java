package org.smtbridge.core;

/**
 * Kind 的种类标签。
 */
public enum KindType {
    BOOL,
    BOUNDED,    // 定宽位向量，带符号或无符号
    UNBOUNDED,  // 无界整数
    REAL,       // 代数实数
    FLOAT,
    DOUBLE,
    USER_SORT   // 未解释排序
}
