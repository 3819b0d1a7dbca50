package org.smtbridge.sexpr;

import lombok.Getter;
import org.smtbridge.core.SmtLibException;

/**
 * 求解器输出无法读成 S 表达式。
 */
@Getter
public class SExprParseException extends SmtLibException {

    private final String reason;
    private final String input;

    public SExprParseException(String reason, String input) {
        super("Failed to parse S-Expr: " + reason + "\n*** Input : <" + input + ">");
        this.reason = reason;
        this.input = input;
    }
}
