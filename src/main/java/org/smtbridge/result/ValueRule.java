package org.smtbridge.result;

import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.Kind;
import org.smtbridge.sexpr.SExpr;

/**
 * 模型取值规则，按声明顺序依次尝试，第一个匹配的生效。
 */
public enum ValueRule implements ValueMatcher<ConstantValue> {

    /**
     * 整数字面量绑定到布尔、位向量或无界整数，按 Kind 的宽度和符号截断。
     */
    INTEGER_LITERAL {
        @Override
        public MatchResult<ConstantValue> match(Kind kind, SExpr value) {
            if (!(value instanceof SExpr.Num num) || !kind.isIntegral()) {
                return MatchResult.noMatch();
            }
            if (kind.isBounded() && num.getWidth().isPresent() && num.getWidth().get() != kind.getWidth()) {
                return MatchResult.malformed("bit-vector literal of width " + num.getWidth().get()
                        + " for a reference of kind " + kind);
            }
            return MatchResult.match(ConstantValue.of(kind, num.getValue()));
        }
    },

    REAL_LITERAL {
        @Override
        public MatchResult<ConstantValue> match(Kind kind, SExpr value) {
            if (value instanceof SExpr.RealNum r && kind.isReal()) {
                return MatchResult.match(ConstantValue.ofReal(r.getValue()));
            }
            return MatchResult.noMatch();
        }
    },

    /**
     * z3 有时把整数引用的值打印成实数转换。不做强转，直接按实数绑定。
     */
    REAL_CAST_FALLBACK {
        @Override
        public MatchResult<ConstantValue> match(Kind kind, SExpr value) {
            if (value instanceof SExpr.RealNum r) {
                return MatchResult.match(ConstantValue.ofReal(r.getValue()));
            }
            return MatchResult.noMatch();
        }
    },

    UNINTERPRETED_ELEMENT {
        @Override
        public MatchResult<ConstantValue> match(Kind kind, SExpr value) {
            if (value instanceof SExpr.Symbol s && kind.isUninterpreted()) {
                return MatchResult.match(ConstantValue.ofUserSort(kind, s.getName()));
            }
            return MatchResult.noMatch();
        }
    },

    DOUBLE_PATTERN {
        @Override
        public MatchResult<ConstantValue> match(Kind kind, SExpr value) {
            if (value instanceof SExpr.DoubleNum d && kind.isDouble()) {
                return MatchResult.match(ConstantValue.ofDouble(d.getValue()));
            }
            return MatchResult.noMatch();
        }
    },

    FLOAT_PATTERN {
        @Override
        public MatchResult<ConstantValue> match(Kind kind, SExpr value) {
            if (value instanceof SExpr.FloatNum f && kind.isFloat()) {
                return MatchResult.match(ConstantValue.ofFloat(f.getValue()));
            }
            return MatchResult.noMatch();
        }
    }
}
