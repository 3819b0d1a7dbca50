package org.smtbridge.sexpr;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.sexpr.SExpr.App;
import org.smtbridge.sexpr.SExpr.Num;
import org.smtbridge.sexpr.SExpr.RealNum;
import org.smtbridge.sexpr.SExpr.Symbol;
import org.smtbridge.utils.AlgebraicReal;
import org.smtbridge.utils.FloatingPoints;
import org.smtbridge.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把求解器输出的一行文本读成 {@link SExpr}。
 * 无状态的入口是 {@link #parse(String)}；每次调用内部使用一个独立的解析器实例。
 * 非法输入一律抛出 {@link SExprParseException}，附带可读的原因。
 */
public final class SExprParser {

    private static final Logger logger = LoggerFactory.getLogger(SExprParser.class);

    private static final Pattern BINARY_DIGITS = Pattern.compile("[01]+");
    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9a-fA-F]+");
    private static final Pattern DECIMAL_DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern BV_LITERAL = Pattern.compile("bv([0-9]+)(\\[[0-9]+])?");
    private static final Pattern REAL_LITERAL = Pattern.compile("[0-9]+\\.[0-9]+");

    // 求解器的模型输出不会嵌套到这个深度；SExpr 的打印和比较是递归的
    static final int MAX_DEPTH = 1000;

    private final String input;
    private final List<String> tokens;
    private int pos;

    private SExprParser(String input) {
        this.input = input;
        this.tokens = tokenize(input);
        this.pos = 0;
    }

    /**
     * 解析一行求解器输出。
     * @param line 原始文本。
     * @return 解析得到的树。
     * @throws SExprParseException 输入不是一个完整的 S 表达式，或求解器报告了 error。
     */
    public static SExpr parse(String line) {
        SExprParser parser = new SExprParser(line == null ? "" : line);
        SExpr result = parser.parseTop();
        logger.debug("解析 S 表达式: {} => {}", line, result);
        return result;
    }

    // ========== 词法 ==========

    private List<String> tokenize(String text) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                flush(current, result);
                i++;
            } else if (c == '(' || c == ')') {
                flush(current, result);
                result.add(String.valueOf(c));
                i++;
            } else if (c == ':' && i + 1 < text.length() && text.charAt(i + 1) == ':') {
                flush(current, result);
                result.add("::");
                i += 2;
            } else if (c == '|') {
                // |带空格或括号的符号| 整体作为一个词
                int end = text.indexOf('|', i + 1);
                if (end < 0) {
                    throw die("unterminated quoted symbol");
                }
                current.append(text, i, end + 1);
                i = end + 1;
            } else if (c == '"') {
                int end = i + 1;
                while (true) {
                    end = text.indexOf('"', end);
                    if (end < 0) {
                        throw die("unterminated string literal");
                    }
                    // "" 是字符串内部的转义引号
                    if (end + 1 < text.length() && text.charAt(end + 1) == '"') {
                        end += 2;
                        continue;
                    }
                    break;
                }
                current.append(text, i, end + 1);
                i = end + 1;
            } else {
                current.append(c);
                i++;
            }
        }
        flush(current, result);
        return result;
    }

    private static void flush(StringBuilder current, List<String> result) {
        if (current.length() > 0) {
            result.add(current.toString());
            current.setLength(0);
        }
    }

    // ========== 语法 ==========

    private SExpr parseTop() {
        if (tokens.isEmpty()) {
            throw die("ran out of tokens");
        }
        SExpr result;
        String first = tokens.get(0);
        if ("(".equals(first)) {
            result = parseExpr();
            if (pos < tokens.size()) {
                throw die("extra tokens after valid input");
            }
        } else if (")".equals(first)) {
            throw die("extra tokens after close paren");
        } else if (tokens.size() == 1) {
            result = parseToken(first);
        } else {
            throw die("ill-formed s-expr");
        }

        if (result instanceof App app && app.size() == 2 && app.get(0).isSymbol("error")) {
            throw die("Solver returned an error: " + app.get(1));
        }
        return result;
    }

    private SExpr parseExpr() {
        if (pos >= tokens.size()) {
            throw die("failed to grab s-expr application");
        }
        String token = tokens.get(pos++);
        if (")".equals(token)) {
            throw die("extra tokens after close paren");
        }
        if (!"(".equals(token)) {
            return parseToken(token);
        }
        // 显式栈：每个元素是一个尚未闭合的应用
        Deque<List<SExpr>> open = new ArrayDeque<>();
        open.push(new ArrayList<>());
        while (true) {
            if (pos >= tokens.size()) {
                throw die("failed to grab s-expr application");
            }
            String next = tokens.get(pos++);
            if ("(".equals(next)) {
                if (open.size() >= MAX_DEPTH) {
                    throw die("s-expr nested deeper than " + MAX_DEPTH);
                }
                open.push(new ArrayList<>());
            } else if (")".equals(next)) {
                SExpr closed = simplify(SExpr.app(open.pop()));
                if (open.isEmpty()) {
                    return closed;
                }
                open.peek().add(closed);
            } else {
                open.peek().add(parseToken(next));
            }
        }
    }

    private SExpr parseToken(String token) {
        if ("false".equals(token)) {
            return SExpr.num(0);
        }
        if ("true".equals(token)) {
            return SExpr.num(1);
        }
        if (token.startsWith("#b")) {
            String digits = token.substring(2);
            if (!BINARY_DIGITS.matcher(digits).matches()) {
                throw die("cannot read number: " + token);
            }
            return SExpr.num(new BigInteger(digits, 2), digits.length());
        }
        if (token.startsWith("#x")) {
            String digits = token.substring(2);
            if (!HEX_DIGITS.matcher(digits).matches()) {
                throw die("cannot read number: " + token);
            }
            return SExpr.num(new BigInteger(digits, 16), 4 * digits.length());
        }
        // 0b / bv 前缀后面不是数字时只是普通符号，例如 bvadd
        if (token.startsWith("0b") && BINARY_DIGITS.matcher(token.substring(2)).matches()) {
            String digits = token.substring(2);
            return SExpr.num(new BigInteger(digits, 2), digits.length());
        }
        Matcher bv = BV_LITERAL.matcher(token);
        if (bv.matches()) {
            return SExpr.num(new BigInteger(bv.group(1)), null);
        }
        if (Character.isDigit(token.charAt(0))) {
            return readNumber(token, token);
        }
        if (token.length() > 1 && token.charAt(0) == '-' && Character.isDigit(token.charAt(1))) {
            SExpr magnitude = readNumber(token.substring(1), token);
            if (magnitude instanceof Num n) {
                return SExpr.num(n.getValue().negate(), null);
            }
            return SExpr.real(((RealNum) magnitude).getValue().negate());
        }
        return SExpr.sym(token);
    }

    private SExpr readNumber(String text, String token) {
        if (DECIMAL_DIGITS.matcher(text).matches()) {
            return SExpr.num(new BigInteger(text), null);
        }
        // 结尾的 '?' 表示近似值
        boolean exact = !text.endsWith("?");
        String digits = exact ? text : text.substring(0, text.length() - 1);
        if (!REAL_LITERAL.matcher(digits).matches()) {
            throw die("cannot read number: " + token);
        }
        return SExpr.real(exact ? AlgebraicReal.exact(Rational.valueOf(digits)) : AlgebraicReal.approximate(digits));
    }

    // ========== 化简 ==========

    /**
     * 把求解器打印数值时常用的几种应用形式化简为原子。其余形式原样返回。
     */
    private SExpr simplify(App app) {
        List<SExpr> xs = app.getItems();
        if (xs.isEmpty() || !(xs.get(0) instanceof Symbol head)) {
            return app;
        }
        String f = head.getName();
        int n = xs.size();

        switch (f) {
            case "to_int", "to_real" -> {
                // 忽略类型转换
                if (n == 2 && xs.get(1) instanceof RealNum) {
                    return xs.get(1);
                }
            }
            case "/" -> {
                if (n == 3) {
                    AlgebraicReal a = exactReal(xs.get(1));
                    AlgebraicReal b = exactReal(xs.get(2));
                    if (a != null && b != null && !b.getValue().isZero()) {
                        return SExpr.real(a.divide(b));
                    }
                }
            }
            case "-" -> {
                if (n == 2 && xs.get(1) instanceof RealNum r && r.getValue().getType() != AlgebraicReal.RealType.ROOT) {
                    return SExpr.real(r.getValue().negate());
                }
                if (n == 2 && xs.get(1) instanceof Num num) {
                    return SExpr.num(num.getValue().negate(), num.getWidth().orElse(null));
                }
            }
            case "_" -> {
                // CVC4 风格的位向量: (_ bv10 8)
                if (n == 3 && xs.get(1) instanceof Num value && xs.get(2) instanceof Num width) {
                    return SExpr.num(value.getValue(), bitVectorWidth(app, value.getValue(), width.getValue()));
                }
                if (n == 4 && xs.get(1) instanceof Symbol special) {
                    SExpr fp = specialFloatingPoint(special.getName(), xs.get(2), xs.get(3));
                    if (fp != null) {
                        return fp;
                    }
                }
            }
            case "root-obj" -> {
                if (n == 3 && xs.get(2) instanceof Num k
                        && xs.get(1) instanceof App poly && poly.head().map(h -> h.isSymbol("+")).orElse(false)) {
                    if (poly.size() < 2) {
                        throw die("Cannot parse a root-obj, empty polynomial: " + app);
                    }
                    if (!fitsInt(k.getValue()) || k.getValue().signum() <= 0) {
                        throw die("Cannot parse a root-obj, bad root index: " + k);
                    }
                    List<Pair<BigInteger, Integer>> terms = new ArrayList<>();
                    for (SExpr term : poly.getItems().subList(1, poly.size())) {
                        terms.add(coefficient(term));
                    }
                    return SExpr.real(AlgebraicReal.root(k.getValue().intValueExact(), terms));
                }
            }
            case "as" -> {
                if (n == 3) {
                    SExpr sort = xs.get(2);
                    if (sort.isSymbol("Float32") || isFloatingPointSort(sort, 8, 24)) {
                        return SExpr.flt((float) toDouble(xs.get(1), true));
                    }
                    if (sort.isSymbol("Float64") || isFloatingPointSort(sort, 11, 53)) {
                        return SExpr.dbl(toDouble(xs.get(1), false));
                    }
                }
            }
            case "fp" -> {
                if (n == 4 && xs.get(1) instanceof Num s && xs.get(2) instanceof Num e && xs.get(3) instanceof Num m
                        && hasWidth(s, 1)) {
                    // 注意尾数宽度是 23/52，不是 24/53
                    if (hasWidth(e, FloatingPoints.FLOAT_EXPONENT_WIDTH) && hasWidth(m, FloatingPoints.FLOAT_SIGNIFICAND_WIDTH)) {
                        return SExpr.flt(FloatingPoints.floatFromTriple(
                                s.getValue().longValue(), e.getValue().longValue(), m.getValue().longValue()));
                    }
                    if (hasWidth(e, FloatingPoints.DOUBLE_EXPONENT_WIDTH) && hasWidth(m, FloatingPoints.DOUBLE_SIGNIFICAND_WIDTH)) {
                        return SExpr.dbl(FloatingPoints.doubleFromTriple(
                                s.getValue().longValue(), e.getValue().longValue(), m.getValue().longValue()));
                    }
                }
            }
            default -> {
                return app;
            }
        }
        return app;
    }

    private static AlgebraicReal exactReal(SExpr e) {
        if (e instanceof Num num) {
            return AlgebraicReal.exact(Rational.valueOf(num.getValue()));
        }
        if (e instanceof RealNum r && r.getValue().isExact()) {
            return r.getValue();
        }
        return null;
    }

    /**
     * (_ bvN w) 的宽度：至少为 1，且能容纳 N；否则打印出的 #b 字面量读回来宽度会变。
     */
    private int bitVectorWidth(App literal, BigInteger value, BigInteger width) {
        if (!fitsInt(width) || width.signum() <= 0 || value.bitLength() > width.intValue()) {
            throw die("cannot read number: " + literal);
        }
        return width.intValue();
    }

    private static boolean fitsInt(BigInteger n) {
        return n.bitLength() < Integer.SIZE;
    }

    private static boolean hasWidth(Num num, int width) {
        return num.getWidth().map(w -> w == width).orElse(false);
    }

    private static boolean isFloatingPointSort(SExpr sort, long eb, long sb) {
        return sort instanceof App a && a.size() == 4
                && a.get(0).isSymbol("_") && a.get(1).isSymbol("FloatingPoint")
                && a.get(2).isNum(eb) && a.get(3).isNum(sb);
    }

    /**
     * (_ NaN 8 24)、(_ +oo 11 53) 之类的特殊浮点值。
     */
    private static SExpr specialFloatingPoint(String name, SExpr eb, SExpr sb) {
        boolean isFloat = eb.isNum(8) && sb.isNum(24);
        boolean isDouble = eb.isNum(11) && sb.isNum(53);
        if (!isFloat && !isDouble) {
            return null;
        }
        double value;
        switch (name) {
            case "NaN" -> value = Double.NaN;
            case "+oo" -> value = Double.POSITIVE_INFINITY;
            case "-oo" -> value = Double.NEGATIVE_INFINITY;
            case "+zero" -> value = 0.0;
            case "-zero" -> value = -0.0;
            default -> {
                return null;
            }
        }
        return isFloat ? SExpr.flt((float) value) : SExpr.dbl(value);
    }

    /**
     * {@code (as v Float32)} 中 v 的数值。
     */
    private double toDouble(SExpr value, boolean single) {
        if (value instanceof SExpr.FloatNum f) {
            return f.getValue();
        }
        if (value instanceof SExpr.DoubleNum d) {
            return d.getValue();
        }
        if (value instanceof RealNum r && r.getValue().getType() != AlgebraicReal.RealType.ROOT) {
            return r.getValue().getValue().doubleValue();
        }
        if (value instanceof Num num) {
            return num.getValue().doubleValue();
        }
        if (value instanceof App a && a.size() == 4) {
            return toDouble(a.get(1), single);
        }
        if (value instanceof Symbol s) {
            String name = StringUtils.stripStart(s.getName(), "+");
            switch (name) {
                case "plusInfinity", "oo" -> {
                    return Double.POSITIVE_INFINITY;
                }
                case "minusInfinity", "-oo" -> {
                    return Double.NEGATIVE_INFINITY;
                }
                case "zero" -> {
                    return 0.0;
                }
                case "-zero" -> {
                    return -0.0;
                }
                case "NaN" -> {
                    return Double.NaN;
                }
                default -> {
                    try {
                        return Double.parseDouble(name);
                    } catch (NumberFormatException e) {
                        throw die("Cannot parse a " + (single ? "float" : "double") + " value from: " + s.getName());
                    }
                }
            }
        }
        throw die("Cannot parse a " + (single ? "float" : "double") + " value from: " + value);
    }

    /**
     * root-obj 多项式中的一项：k、x、(* k x)、(^ x p)、(* k (^ x p))。
     */
    private Pair<BigInteger, Integer> coefficient(SExpr term) {
        if (term instanceof Num k) {
            return Pair.of(k.getValue(), 0);
        }
        if (term.isSymbol("x")) {
            return Pair.of(BigInteger.ONE, 1);
        }
        Integer power = power(term);
        if (power != null) {
            return Pair.of(BigInteger.ONE, power);
        }
        if (term instanceof App a && a.size() == 3 && a.get(0).isSymbol("*") && a.get(1) instanceof Num k) {
            if (a.get(2).isSymbol("x")) {
                return Pair.of(k.getValue(), 1);
            }
            Integer p = power(a.get(2));
            if (p != null) {
                return Pair.of(k.getValue(), p);
            }
        }
        throw die("Cannot parse a root-obj, processing term: " + term);
    }

    private Integer power(SExpr term) {
        if (term instanceof App a && a.size() == 3 && a.get(0).isSymbol("^")
                && a.get(1).isSymbol("x") && a.get(2) instanceof Num p) {
            if (!fitsInt(p.getValue()) || p.getValue().signum() < 0) {
                throw die("Cannot parse a root-obj, bad power: " + term);
            }
            return p.getValue().intValueExact();
        }
        return null;
    }

    private SExprParseException die(String reason) {
        logger.debug("S 表达式解析失败: {}，输入: {}", reason, input);
        return new SExprParseException(reason, input);
    }
}
