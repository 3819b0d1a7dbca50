package org.smtbridge.result;

import lombok.Getter;
import org.smtbridge.core.SmtLibException;
import org.smtbridge.sexpr.SExpr;

import java.util.Optional;

/**
 * 解码模型或目标值时的致命错误，带有原始行和（如果有）无法匹配的子树。
 */
@Getter
public class ModelExtractionException extends SmtLibException {

    private final String line;
    private final SExpr tree;

    public ModelExtractionException(String message, String line) {
        this(message, line, (SExpr) null);
    }

    public ModelExtractionException(String message, String line, SExpr tree) {
        super(message);
        this.line = line;
        this.tree = tree;
    }

    public ModelExtractionException(String message, String line, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.tree = null;
    }

    public Optional<SExpr> getTree() {
        return Optional.ofNullable(tree);
    }
}
