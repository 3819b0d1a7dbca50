package org.smtbridge.smtlib;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.Kind;
import org.smtbridge.core.SmtLibException;
import org.smtbridge.core.SymRef;
import org.smtbridge.problem.ArrayInfo;
import org.smtbridge.problem.Assignment;
import org.smtbridge.problem.Axiom;
import org.smtbridge.problem.CaseCondition;
import org.smtbridge.problem.LookupTable;
import org.smtbridge.problem.Objective;
import org.smtbridge.problem.Operator;
import org.smtbridge.problem.ProblemDescriptor;
import org.smtbridge.problem.TermExpression;
import org.smtbridge.problem.SkolemEntry;
import org.smtbridge.problem.UninterpretedSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SMT-LIB2 方言的编码器。
 * <p>
 * preamble 包含声明、公理和断言，不含 check-sat；postlude 取回模型：
 * 优化时为 {@code (get-objectives)}，否则每个顶层存在变量一条 {@code (get-value (sN))}，
 * 这样求解器对每个输入各回复一行 {@code ((sN v))}。
 */
public final class SmtLib2Converter implements SmtLibConverter {

    private static final Logger logger = LoggerFactory.getLogger(SmtLib2Converter.class);

    // 浮点运算统一使用的舍入模式
    private static final String ROUNDING_MODE = "RNE";

    @Override
    public Pair<String, String> convert(ProblemDescriptor problem) {
        List<SkolemEntry> skolemMap = problem.getEffectiveSkolemMap();
        Map<SymRef, List<SymRef>> skolemized = new HashMap<>();
        List<SymRef> bound = new ArrayList<>();
        List<SymRef> topLevel = new ArrayList<>();
        for (SkolemEntry entry : skolemMap) {
            if (entry.isUniversal()) {
                bound.add(entry.getRef());
            } else if (entry.isTopLevel()) {
                topLevel.add(entry.getRef());
            } else {
                skolemized.put(entry.getRef(), entry.getDependencies());
            }
        }
        Renderer renderer = new Renderer(skolemized);
        CaseCondition caseCondition = problem.getCaseCondition();

        List<String> pre = new ArrayList<>();
        problem.getComments().forEach(c -> pre.add("; " + c));
        pre.add("(set-option :produce-models true)");
        if (caseCondition.isOptimization()) {
            pre.add("(set-option :opt.priority " + caseCondition.getStyle().getPriority() + ")");
        }
        problem.getConfig().getLogic().ifPresent(logic -> pre.add("(set-logic " + logic + ")"));

        declareSorts(problem, pre);

        pre.add("; --- inputs ---");
        for (SymRef ref : topLevel) {
            pre.add("(declare-fun " + ref + " () " + ref.getKind().toSmtLib() + ")");
        }
        skolemized.forEach((ref, deps) -> pre.add("(declare-fun " + ref + " ("
                + deps.stream().map(d -> d.getKind().toSmtLib()).collect(Collectors.joining(" "))
                + ") " + ref.getKind().toSmtLib() + ")"));

        pre.add("; --- constants ---");
        for (Map.Entry<SymRef, ConstantValue> c : problem.getConstants().entrySet()) {
            SymRef ref = c.getKey();
            if (ref.equals(SymRef.TRUE_REF) || ref.equals(SymRef.FALSE_REF)) {
                continue;
            }
            pre.add("(define-fun " + ref + " () " + ref.getKind().toSmtLib() + " " + c.getValue().toSmtLib() + ")");
        }

        pre.add("; --- tables ---");
        for (LookupTable table : problem.getTables()) {
            pre.add("(declare-fun " + table.getName() + " (" + table.getIndexKind().toSmtLib() + ") "
                    + table.getResultKind().toSmtLib() + ")");
        }

        pre.add("; --- arrays ---");
        for (ArrayInfo array : problem.getArrays()) {
            pre.add("; " + array.getUserName());
            pre.add("(declare-fun " + array.getName() + " () " + array.getSort() + ")");
        }

        pre.add("; --- uninterpreted constants/functions ---");
        for (UninterpretedSignature ui : problem.getUninterpretedFunctions()) {
            pre.add("(declare-fun " + ui.getName() + " ("
                    + ui.getArgumentKinds().stream().map(Kind::toSmtLib).collect(Collectors.joining(" "))
                    + ") " + ui.getResultKind().toSmtLib() + ")");
        }

        pre.add("; --- user given axioms ---");
        for (Axiom axiom : problem.getAxioms()) {
            pre.add("; -- user given axiom: " + axiom.getName());
            pre.addAll(axiom.getLines());
        }

        pre.add("; --- formula ---");
        String goal = problem.isSat()
                ? renderer.ref(problem.getOutput())
                : "(not " + renderer.ref(problem.getOutput()) + ")";
        if (bound.isEmpty()) {
            for (Assignment a : problem.getAssignments()) {
                SymRef target = a.getTarget();
                pre.add("(define-fun " + target + " () " + target.getKind().toSmtLib() + " "
                        + renderer.term(a.getExpression(), problem) + ")");
            }
            for (SymRef c : problem.getConstraints()) {
                pre.add("(assert " + renderer.ref(c) + ")");
            }
            pre.add("(assert " + goal + ")");
        } else {
            pre.add(quantifiedBody(bound, problem, renderer, goal));
        }

        // 表和数组的内容可能引用上面定义的值，放在最后
        for (LookupTable table : problem.getTables()) {
            List<SymRef> elements = table.getElements();
            for (int i = 0; i < elements.size(); i++) {
                pre.add("(assert (= (" + table.getName() + " " + ConstantValue.of(table.getIndexKind(), i).toSmtLib()
                        + ") " + renderer.ref(elements.get(i)) + "))");
            }
        }
        for (ArrayInfo array : problem.getArrays()) {
            array.getInitialElement().ifPresent(init -> pre.add("(assert (= " + array.getName()
                    + " ((as const " + array.getSort() + ") " + renderer.ref(init) + ")))"));
        }

        List<String> post = new ArrayList<>();
        if (caseCondition.isOptimization()) {
            for (Objective objective : caseCondition.getObjectives()) {
                SymRef variable = objective.getOperands().getLeft();
                SymRef expression = objective.getOperands().getRight();
                if (!variable.equals(expression)) {
                    pre.add("(assert (= " + renderer.ref(variable) + " " + renderer.ref(expression) + "))");
                }
                pre.add("(" + objective.getDirection().getCommand() + " " + renderer.ref(variable) + ")");
            }
            post.add("(get-objectives)");
        } else {
            for (SymRef ref : topLevel) {
                post.add("(get-value (" + ref + "))");
            }
        }

        logger.info("生成 SMT-LIB2 程序: preamble {} 行, postlude {} 行", pre.size(), post.size());
        return Pair.of(String.join("\n", pre), String.join("\n", post));
    }

    private static void declareSorts(ProblemDescriptor problem, List<String> pre) {
        Map<String, Kind> sorts = new LinkedHashMap<>();
        problem.getKinds().stream().filter(Kind::isUninterpreted).forEach(k -> sorts.putIfAbsent(k.getSortName(), k));
        if (sorts.isEmpty()) {
            return;
        }
        pre.add("; --- uninterpreted sorts ---");
        for (Kind sort : sorts.values()) {
            pre.add(sort.getEnumeration()
                    .map(elements -> "(declare-datatypes () ((" + sort.getSortName() + " "
                            + String.join(" ", elements) + ")))")
                    .orElse("(declare-sort " + sort.getSortName() + " 0)"));
        }
    }

    /**
     * 有全称变量时整个公式放进一个 forall，赋值用嵌套的 let 依次绑定。
     */
    private static String quantifiedBody(List<SymRef> bound, ProblemDescriptor problem, Renderer renderer, String goal) {
        StringBuilder sb = new StringBuilder("(assert (forall (");
        sb.append(bound.stream().map(b -> "(" + b + " " + b.getKind().toSmtLib() + ")").collect(Collectors.joining(" ")));
        sb.append(")");
        for (Assignment a : problem.getAssignments()) {
            sb.append("\n            (let ((").append(a.getTarget()).append(" ")
                    .append(renderer.term(a.getExpression(), problem)).append("))");
        }
        List<String> conjuncts = new ArrayList<>();
        problem.getConstraints().forEach(c -> conjuncts.add(renderer.ref(c)));
        conjuncts.add(goal);
        sb.append("\n            ");
        sb.append(conjuncts.size() == 1 ? conjuncts.get(0) : "(and " + String.join(" ", conjuncts) + ")");
        sb.append(")".repeat(problem.getAssignments().size()));
        sb.append("))");
        return sb.toString();
    }

    /**
     * 把符号引用和运算写成 SMT-LIB2 项。
     */
    private static final class Renderer {

        private final Map<SymRef, List<SymRef>> skolemized;

        Renderer(Map<SymRef, List<SymRef>> skolemized) {
            this.skolemized = skolemized;
        }

        String ref(SymRef r) {
            if (r.equals(SymRef.TRUE_REF)) {
                return "true";
            }
            if (r.equals(SymRef.FALSE_REF)) {
                return "false";
            }
            List<SymRef> deps = skolemized.get(r);
            if (deps == null || deps.isEmpty()) {
                return r.toString();
            }
            // 斯科伦函数作用在它依赖的全称变量上
            return "(" + r + " " + deps.stream().map(SymRef::toString).collect(Collectors.joining(" ")) + ")";
        }

        String term(TermExpression e, ProblemDescriptor problem) {
            Operator op = e.getOperator();
            List<String> args = e.getArguments().stream().map(this::ref).collect(Collectors.toList());
            Kind k = e.getArguments().isEmpty() ? Kind.BOOL : e.getArguments().get(0).getKind();

            return switch (op) {
                case PLUS -> arith(op, k, "bvadd", "+", "fp.add", args);
                case MINUS -> arith(op, k, "bvsub", "-", "fp.sub", args);
                case TIMES -> arith(op, k, "bvmul", "*", "fp.mul", args);
                case NEGATE -> {
                    if (k.isBounded()) {
                        yield app("bvneg", args);
                    }
                    if (k.isUnbounded() || k.isReal()) {
                        yield app("-", args);
                    }
                    if (k.isFloat() || k.isDouble()) {
                        yield app("fp.neg", args);
                    }
                    throw unsupported(op, k);
                }
                case ABS -> {
                    String a = args.get(0);
                    if (k.isBounded()) {
                        yield k.isSigned()
                                ? "(ite (bvslt " + a + " " + zero(k) + ") (bvneg " + a + ") " + a + ")"
                                : a;
                    }
                    if (k.isUnbounded()) {
                        yield "(abs " + a + ")";
                    }
                    if (k.isReal()) {
                        yield "(ite (< " + a + " 0.0) (- " + a + ") " + a + ")";
                    }
                    if (k.isFloat() || k.isDouble()) {
                        yield "(fp.abs " + a + ")";
                    }
                    throw unsupported(op, k);
                }
                case QUOT -> {
                    if (k.isBounded()) {
                        yield app(k.isSigned() ? "bvsdiv" : "bvudiv", args);
                    }
                    if (k.isUnbounded()) {
                        yield app("div", args);
                    }
                    if (k.isReal()) {
                        yield app("/", args);
                    }
                    if (k.isFloat() || k.isDouble()) {
                        yield "(fp.div " + ROUNDING_MODE + " " + String.join(" ", args) + ")";
                    }
                    throw unsupported(op, k);
                }
                case REM -> {
                    if (k.isBounded()) {
                        yield app(k.isSigned() ? "bvsrem" : "bvurem", args);
                    }
                    if (k.isUnbounded()) {
                        yield app("mod", args);
                    }
                    if (k.isFloat() || k.isDouble()) {
                        yield app("fp.rem", args);
                    }
                    throw unsupported(op, k);
                }
                case EQUAL -> app(k.isFloat() || k.isDouble() ? "fp.eq" : "=", args);
                case NOT_EQUAL -> k.isFloat() || k.isDouble()
                        ? "(not " + app("fp.eq", args) + ")"
                        : app("distinct", args);
                case LESS_THAN -> compare(op, k, "lt", "<", "fp.lt", args);
                case LESS_EQ -> compare(op, k, "le", "<=", "fp.leq", args);
                case GREATER_THAN -> compare(op, k, "gt", ">", "fp.gt", args);
                case GREATER_EQ -> compare(op, k, "ge", ">=", "fp.geq", args);
                case ITE -> app("ite", args);
                case AND -> logical(op, k, "and", "bvand", args);
                case OR -> logical(op, k, "or", "bvor", args);
                case XOR -> logical(op, k, "xor", "bvxor", args);
                case NOT -> logical(op, k, "not", "bvnot", args);
                case SHIFT_LEFT -> shift(op, k, "bvshl", e, args);
                case SHIFT_RIGHT -> shift(op, k, k.isSigned() ? "bvashr" : "bvlshr", e, args);
                case ROTATE_LEFT -> indexed(op, k, "rotate_left", e, args);
                case ROTATE_RIGHT -> indexed(op, k, "rotate_right", e, args);
                case EXTRACT -> {
                    if (!k.isBounded() || e.getParameters().size() != 2) {
                        throw unsupported(op, k);
                    }
                    yield "((_ extract " + e.getParameters().get(0) + " " + e.getParameters().get(1) + ") " + args.get(0) + ")";
                }
                case JOIN -> {
                    if (!k.isBounded()) {
                        throw unsupported(op, k);
                    }
                    yield app("concat", args);
                }
                case LOOKUP -> lookup(e, problem, args);
                case READ_ARRAY -> "(select " + target(e) + " " + args.get(0) + ")";
                case UNINTERPRETED -> args.isEmpty() ? target(e) : "(" + target(e) + " " + String.join(" ", args) + ")";
            };
        }

        private String arith(Operator op, Kind k, String bv, String num, String fp, List<String> args) {
            if (k.isBounded()) {
                return app(bv, args);
            }
            if (k.isUnbounded() || k.isReal()) {
                return app(num, args);
            }
            if (k.isFloat() || k.isDouble()) {
                return "(" + fp + " " + ROUNDING_MODE + " " + String.join(" ", args) + ")";
            }
            throw unsupported(op, k);
        }

        private String compare(Operator op, Kind k, String bvSuffix, String num, String fp, List<String> args) {
            if (k.isBounded()) {
                return app((k.isSigned() ? "bvs" : "bvu") + bvSuffix, args);
            }
            if (k.isUnbounded() || k.isReal()) {
                return app(num, args);
            }
            if (k.isFloat() || k.isDouble()) {
                return app(fp, args);
            }
            throw unsupported(op, k);
        }

        private String logical(Operator op, Kind k, String bool, String bv, List<String> args) {
            if (k.isBoolean()) {
                return app(bool, args);
            }
            if (k.isBounded()) {
                return app(bv, args);
            }
            throw unsupported(op, k);
        }

        private String shift(Operator op, Kind k, String f, TermExpression e, List<String> args) {
            if (!k.isBounded() || e.getParameters().size() != 1) {
                throw unsupported(op, k);
            }
            String amount = ConstantValue.bitVectorLiteral(BigInteger.valueOf(e.getParameters().get(0)), k.getWidth());
            return "(" + f + " " + args.get(0) + " " + amount + ")";
        }

        private String indexed(Operator op, Kind k, String f, TermExpression e, List<String> args) {
            if (!k.isBounded() || e.getParameters().size() != 1) {
                throw unsupported(op, k);
            }
            return "((_ " + f + " " + e.getParameters().get(0) + ") " + args.get(0) + ")";
        }

        /**
         * 下标越界时取默认值（第二个实参）。
         */
        private String lookup(TermExpression e, ProblemDescriptor problem, List<String> args) {
            String name = target(e);
            LookupTable table = problem.getTables().stream()
                    .filter(t -> t.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new SmtLibException("Unknown lookup table: " + name));
            String access = "(" + name + " " + args.get(0) + ")";
            if (args.size() < 2) {
                return access;
            }
            Kind idx = table.getIndexKind();
            int elements = table.getElements().size();
            String inRange;
            if (idx.isBounded() && !coversAllIndices(idx, elements)) {
                String size = ConstantValue.of(idx, elements).toSmtLib();
                inRange = idx.isSigned()
                        ? "(and (bvsle " + zero(idx) + " " + args.get(0) + ") (bvslt " + args.get(0) + " " + size + "))"
                        : "(bvult " + args.get(0) + " " + size + ")";
            } else if (idx.isBounded()) {
                // 表长超过下标类型的最大值，写成位向量字面量会回绕，只剩下界
                if (!idx.isSigned()) {
                    return access;
                }
                inRange = "(bvsle " + zero(idx) + " " + args.get(0) + ")";
            } else if (idx.isUnbounded()) {
                String size = ConstantValue.of(idx, elements).toSmtLib();
                inRange = "(and (<= 0 " + args.get(0) + ") (< " + args.get(0) + " " + size + "))";
            } else {
                throw unsupported(Operator.LOOKUP, idx);
            }
            return "(ite " + inRange + " " + access + " " + args.get(1) + ")";
        }

        /**
         * 下标类型的每个非负值都落在表内。
         */
        private static boolean coversAllIndices(Kind idx, int elements) {
            int valueBits = idx.isSigned() ? idx.getWidth() - 1 : idx.getWidth();
            return BigInteger.valueOf(elements).compareTo(BigInteger.ONE.shiftLeft(valueBits)) >= 0;
        }

        private static String target(TermExpression e) {
            return e.getTarget().orElseThrow(() -> new SmtLibException("Operator " + e.getOperator() + " needs a target name"));
        }

        private static String zero(Kind k) {
            return ConstantValue.of(k, 0).toSmtLib();
        }

        private static String app(String f, List<String> args) {
            return "(" + f + " " + String.join(" ", args) + ")";
        }

        private static SmtLibException unsupported(Operator op, Kind k) {
            logger.error("运算 {} 无法作用于 {}", op, k);
            return new SmtLibException("Operator " + op + " has no SMT-LIB2 rendering for kind " + k);
        }
    }
}
