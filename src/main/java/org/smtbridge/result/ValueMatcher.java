package org.smtbridge.result;

import org.smtbridge.core.Kind;
import org.smtbridge.sexpr.SExpr;

/**
 * 一条取值规则：给定引用的 Kind 和值子树，尝试构造对应的常量。
 */
@FunctionalInterface
public interface ValueMatcher<T> {

    MatchResult<T> match(Kind kind, SExpr value);
}
