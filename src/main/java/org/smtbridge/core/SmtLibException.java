package org.smtbridge.core;

/**
 * 编码或解码 SMT-LIB 文本时的致命错误。所有错误都不会被重试。
 */
public class SmtLibException extends RuntimeException {

    public SmtLibException(String message) {
        super(message);
    }

    public SmtLibException(String message, Throwable cause) {
        super(message, cause);
    }
}
