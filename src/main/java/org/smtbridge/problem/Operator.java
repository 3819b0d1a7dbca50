package org.smtbridge.problem;

/**
 * 赋值右侧可以使用的运算。AND/OR/XOR/NOT 对布尔是逻辑运算，对位向量是按位运算。
 */
public enum Operator {
    PLUS,
    MINUS,
    TIMES,
    NEGATE,
    ABS,
    QUOT,
    REM,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_EQ,
    GREATER_THAN,
    GREATER_EQ,
    ITE,
    AND,
    OR,
    XOR,
    NOT,
    SHIFT_LEFT,     // 参数: 位移量
    SHIFT_RIGHT,    // 参数: 位移量
    ROTATE_LEFT,    // 参数: 位移量
    ROTATE_RIGHT,   // 参数: 位移量
    EXTRACT,        // 参数: 高位, 低位
    JOIN,
    LOOKUP,         // 名字: 查找表；最后一个实参是越界时的默认值
    READ_ARRAY,     // 名字: 数组
    UNINTERPRETED   // 名字: 未解释函数
}
