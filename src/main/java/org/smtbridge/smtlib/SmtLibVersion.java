package org.smtbridge.smtlib;

/**
 * 协议版本。目前只有一种文本方言，新的版本在 {@link SmtLibTranslator} 的同一个分派点接入。
 */
public enum SmtLibVersion {
    SMTLIB2
}
