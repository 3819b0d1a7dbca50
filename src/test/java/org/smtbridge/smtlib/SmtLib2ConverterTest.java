package org.smtbridge.smtlib;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smtbridge.core.ConstantValue;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SmtLibException;
import org.smtbridge.core.SymRef;
import org.smtbridge.problem.ArrayInfo;
import org.smtbridge.problem.Assignment;
import org.smtbridge.problem.Axiom;
import org.smtbridge.problem.CaseCondition;
import org.smtbridge.problem.LookupTable;
import org.smtbridge.problem.Objective;
import org.smtbridge.problem.Operator;
import org.smtbridge.problem.OptimizeStyle;
import org.smtbridge.problem.ProblemDescriptor;
import org.smtbridge.problem.TermExpression;
import org.smtbridge.problem.UninterpretedSignature;
import org.smtbridge.solver.KnownSolver;
import org.smtbridge.solver.SmtConfig;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SmtLib2ConverterTest {

    private static final Kind WORD8 = Kind.unsigned(8);
    private static final Kind INT8 = Kind.signed(8);

    private static SmtLib2Converter converter;
    private static SmtConfig z3;

    @BeforeAll
    static void setUp() {
        converter = new SmtLib2Converter();
        z3 = SmtConfig.of(KnownSolver.Z3);
    }

    private static List<String> lines(String text) {
        return text.lines().collect(Collectors.toList());
    }

    /**
     * x, y :: SWord8；s2 = x < y；输出 s2。
     */
    private static ProblemDescriptor.ProblemDescriptorBuilder lessThanProblem() {
        return lessThanProblem(false);
    }

    /**
     * @param universal 输入是否为全称量词；证明 x < y 对所有 x, y 成立时用 true。
     */
    private static ProblemDescriptor.ProblemDescriptorBuilder lessThanProblem(boolean universal) {
        SymRef x = SymRef.of(0, WORD8);
        SymRef y = SymRef.of(1, WORD8);
        SymRef lt = SymRef.of(2, Kind.BOOL);
        return ProblemDescriptor.builder()
                .kind(WORD8).kind(Kind.BOOL)
                .input(universal ? NamedSymVar.forall(x, "x") : NamedSymVar.exists(x, "x"))
                .input(universal ? NamedSymVar.forall(y, "y") : NamedSymVar.exists(y, "y"))
                .assignment(Assignment.of(lt, TermExpression.of(Operator.LESS_THAN, x, y)))
                .output(lt)
                .config(z3);
    }

    private static String render(TermExpression expression, Kind resultKind) {
        SymRef target = SymRef.of(9, resultKind);
        ProblemDescriptor problem = ProblemDescriptor.builder()
                .assignment(Assignment.of(target, expression))
                .output(SymRef.TRUE_REF)
                .config(z3)
                .build();
        String prefix = "(define-fun s9 () " + resultKind.toSmtLib() + " ";
        return lines(converter.convert(problem).getLeft()).stream()
                .filter(l -> l.startsWith(prefix))
                .map(l -> l.substring(prefix.length(), l.length() - 1))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("程序结构 (Program layout)")
    class LayoutTests {

        @Test
        @DisplayName("无量词问题：声明、定义、断言与取值")
        void testSimpleSatProblem() {
            Pair<String, String> program = converter.convert(lessThanProblem().comment("generated for a test").build());
            List<String> pre = lines(program.getLeft());

            assertAll("Preamble of a quantifier-free problem",
                    () -> assertEquals("; generated for a test", pre.get(0)),
                    () -> assertEquals("(set-option :produce-models true)", pre.get(1)),
                    () -> assertTrue(pre.contains("(declare-fun s0 () (_ BitVec 8))")),
                    () -> assertTrue(pre.contains("(declare-fun s1 () (_ BitVec 8))")),
                    () -> assertTrue(pre.contains("(define-fun s2 () Bool (bvult s0 s1))")),
                    () -> assertEquals("(assert s2)", pre.get(pre.size() - 1)),
                    () -> assertFalse(program.getLeft().contains("check-sat"), "check-sat is sent by the caller"),
                    () -> assertEquals("(get-value (s0))\n(get-value (s1))", program.getRight())
            );
        }

        @Test
        @DisplayName("证明时目标取反，全称输入变成顶层声明")
        void testProveNegatesOutput() {
            List<String> pre = lines(converter.convert(lessThanProblem(true).sat(false).build()).getLeft());
            assertAll(
                    () -> assertTrue(pre.contains("(declare-fun s0 () (_ BitVec 8))")),
                    () -> assertTrue(pre.contains("(define-fun s2 () Bool (bvult s0 s1))")),
                    () -> assertTrue(pre.contains("(assert (not s2))")),
                    () -> assertFalse(String.join("\n", pre).contains("forall"))
            );
        }

        @Test
        @DisplayName("额外约束与 logic")
        void testConstraintsAndLogic() {
            SymRef extra = SymRef.of(7, Kind.BOOL);
            List<String> pre = lines(converter.convert(lessThanProblem()
                    .constraint(extra)
                    .config(z3.withLogic("QF_BV"))
                    .build()).getLeft());
            assertAll(
                    () -> assertTrue(pre.contains("(set-logic QF_BV)")),
                    () -> assertTrue(pre.indexOf("(assert s7)") < pre.indexOf("(assert s2)"))
            );
        }

        @Test
        @DisplayName("常量、表、数组、未解释函数、公理")
        void testDeclarations() {
            SymRef c = SymRef.of(5, WORD8);
            SymRef d = SymRef.of(6, Kind.UNBOUNDED);
            ProblemDescriptor problem = lessThanProblem()
                    .kind(Kind.UNBOUNDED)
                    .constant(c, ConstantValue.of(WORD8, 255))
                    .constant(d, ConstantValue.of(Kind.UNBOUNDED, -4))
                    .constant(SymRef.TRUE_REF, ConstantValue.ofBool(true))
                    .table(LookupTable.of(0, WORD8, Kind.UNBOUNDED, List.of(d, d)))
                    .array(ArrayInfo.of(1, "mem", WORD8, WORD8, c))
                    .uninterpretedFunction(UninterpretedSignature.function("f", List.of(WORD8, Kind.BOOL), Kind.UNBOUNDED))
                    .uninterpretedFunction(UninterpretedSignature.constant("k", WORD8))
                    .axiom(Axiom.of("f_positive", List.of("(assert (forall ((a (_ BitVec 8)) (b Bool)) (> (f a b) 0)))")))
                    .build();
            List<String> pre = lines(converter.convert(problem).getLeft());

            assertAll("Declarations",
                    () -> assertTrue(pre.contains("(define-fun s5 () (_ BitVec 8) #xff)")),
                    () -> assertTrue(pre.contains("(define-fun s6 () Int (- 4))")),
                    () -> assertFalse(pre.stream().anyMatch(l -> l.startsWith("(define-fun s-1")), "Reserved refs are never defined"),
                    () -> assertTrue(pre.contains("(declare-fun table0 ((_ BitVec 8)) Int)")),
                    () -> assertTrue(pre.contains("(assert (= (table0 #x00) s6))")),
                    () -> assertTrue(pre.contains("(assert (= (table0 #x01) s6))")),
                    () -> assertTrue(pre.contains("(declare-fun array_1 () (Array (_ BitVec 8) (_ BitVec 8)))")),
                    () -> assertTrue(pre.contains("(assert (= array_1 ((as const (Array (_ BitVec 8) (_ BitVec 8))) s5)))")),
                    () -> assertTrue(pre.contains("(declare-fun f ((_ BitVec 8) Bool) Int)")),
                    () -> assertTrue(pre.contains("(declare-fun k () (_ BitVec 8))")),
                    () -> assertTrue(pre.contains("; -- user given axiom: f_positive")),
                    () -> assertTrue(pre.contains("(assert (forall ((a (_ BitVec 8)) (b Bool)) (> (f a b) 0)))"))
            );
        }

        @Test
        @DisplayName("未解释排序：带枚举的用 datatype，其余用 declare-sort")
        void testSorts() {
            ProblemDescriptor problem = lessThanProblem()
                    .kind(Kind.userSort("Color", List.of("Red", "Green", "Blue")))
                    .kind(Kind.userSort("Q"))
                    .build();
            List<String> pre = lines(converter.convert(problem).getLeft());
            assertAll(
                    () -> assertTrue(pre.contains("(declare-datatypes () ((Color Red Green Blue)))")),
                    () -> assertTrue(pre.contains("(declare-sort Q 0)"))
            );
        }
    }

    @Nested
    @DisplayName("量词 (Quantifiers)")
    class QuantifierTests {

        @Test
        @DisplayName("全称变量：存在变量被斯科伦化，公式包在 forall 中")
        void testSkolemization() {
            SymRef x = SymRef.of(0, Kind.UNBOUNDED);
            SymRef y = SymRef.of(1, Kind.UNBOUNDED);
            SymRef ge = SymRef.of(2, Kind.BOOL);
            ProblemDescriptor problem = ProblemDescriptor.builder()
                    .kind(Kind.UNBOUNDED).kind(Kind.BOOL)
                    .input(NamedSymVar.forall(x, "x"))
                    .input(NamedSymVar.exists(y, "y"))
                    .assignment(Assignment.of(ge, TermExpression.of(Operator.GREATER_EQ, y, x)))
                    .output(ge)
                    .config(z3)
                    .build();
            Pair<String, String> program = converter.convert(problem);

            assertAll("Skolemized program",
                    () -> assertTrue(program.getLeft().contains("(declare-fun s1 (Int) Int)")),
                    () -> assertFalse(program.getLeft().contains("(declare-fun s0 "), "Universals are bound, not declared"),
                    () -> assertTrue(program.getLeft().contains("(assert (forall ((s0 Int))")),
                    () -> assertTrue(program.getLeft().contains("(let ((s2 (>= (s1 s0) s0)))")),
                    () -> assertEquals("", program.getRight(), "Skolem functions have no single value to fetch")
            );
        }

        @Test
        @DisplayName("证明时被绑定的是存在变量")
        void testProveBindsExistentials() {
            SymRef x = SymRef.of(0, Kind.UNBOUNDED);
            SymRef y = SymRef.of(1, Kind.UNBOUNDED);
            SymRef eq = SymRef.of(2, Kind.BOOL);
            ProblemDescriptor problem = ProblemDescriptor.builder()
                    .kind(Kind.UNBOUNDED).kind(Kind.BOOL)
                    .sat(false)
                    .input(NamedSymVar.forall(x, "x"))
                    .input(NamedSymVar.exists(y, "y"))
                    .constraint(eq)
                    .assignment(Assignment.of(eq, TermExpression.of(Operator.EQUAL, x, y)))
                    .output(eq)
                    .config(z3)
                    .build();
            Pair<String, String> program = converter.convert(problem);

            assertAll(
                    () -> assertTrue(program.getLeft().contains("(declare-fun s0 () Int)")),
                    () -> assertTrue(program.getLeft().contains("(assert (forall ((s1 Int))")),
                    () -> assertTrue(program.getLeft().contains("(and s2 (not s2))")),
                    () -> assertEquals("(get-value (s0))", program.getRight())
            );
        }
    }

    @Nested
    @DisplayName("优化 (Optimization)")
    class OptimizationTests {

        @Test
        @DisplayName("目标变量与表达式相等，postlude 取目标值")
        void testObjectives() {
            SymRef x = SymRef.of(0, Kind.UNBOUNDED);
            SymRef goal = SymRef.of(3, Kind.UNBOUNDED);
            SymRef cost = SymRef.of(4, Kind.UNBOUNDED);
            ProblemDescriptor problem = ProblemDescriptor.builder()
                    .kind(Kind.UNBOUNDED)
                    .input(NamedSymVar.exists(x, "x"))
                    .output(SymRef.TRUE_REF)
                    .config(z3)
                    .caseCondition(CaseCondition.optimize(OptimizeStyle.PARETO, List.of(
                            Objective.maximize("goal", goal, x),
                            Objective.minimize("cost", cost, cost))))
                    .build();
            Pair<String, String> program = converter.convert(problem);
            List<String> pre = lines(program.getLeft());

            assertAll("Optimization program",
                    () -> assertTrue(pre.contains("(set-option :opt.priority pareto)")),
                    () -> assertTrue(pre.contains("(assert true)")),
                    () -> assertEquals(pre.indexOf("(assert (= s3 s0))") + 1, pre.indexOf("(maximize s3)")),
                    () -> assertTrue(pre.contains("(minimize s4)")),
                    () -> assertFalse(pre.contains("(assert (= s4 s4))")),
                    () -> assertEquals("(get-objectives)", program.getRight())
            );
        }
    }

    @Nested
    @DisplayName("运算符 (Operators)")
    class OperatorTests {

        @Test
        @DisplayName("按操作数的 Kind 选择运算符")
        void testRenderingByKind() {
            SymRef a8 = SymRef.of(0, WORD8);
            SymRef b8 = SymRef.of(1, WORD8);
            SymRef s8 = SymRef.of(2, INT8);
            SymRef t8 = SymRef.of(3, INT8);
            SymRef i = SymRef.of(4, Kind.UNBOUNDED);
            SymRef j = SymRef.of(5, Kind.UNBOUNDED);
            SymRef r = SymRef.of(6, Kind.REAL);
            SymRef f = SymRef.of(7, Kind.FLOAT);
            SymRef g = SymRef.of(8, Kind.FLOAT);
            SymRef p = SymRef.of(10, Kind.BOOL);
            SymRef q = SymRef.of(11, Kind.BOOL);

            assertAll("Operator rendering",
                    () -> assertEquals("(bvadd s0 s1)", render(TermExpression.of(Operator.PLUS, a8, b8), WORD8)),
                    () -> assertEquals("(+ s4 s5)", render(TermExpression.of(Operator.PLUS, i, j), Kind.UNBOUNDED)),
                    () -> assertEquals("(fp.add RNE s7 s8)", render(TermExpression.of(Operator.PLUS, f, g), Kind.FLOAT)),
                    () -> assertEquals("(bvudiv s0 s1)", render(TermExpression.of(Operator.QUOT, a8, b8), WORD8)),
                    () -> assertEquals("(bvsrem s2 s3)", render(TermExpression.of(Operator.REM, s8, t8), INT8)),
                    () -> assertEquals("(div s4 s5)", render(TermExpression.of(Operator.QUOT, i, j), Kind.UNBOUNDED)),
                    () -> assertEquals("(bvslt s2 s3)", render(TermExpression.of(Operator.LESS_THAN, s8, t8), Kind.BOOL)),
                    () -> assertEquals("(<= s4 s5)", render(TermExpression.of(Operator.LESS_EQ, i, j), Kind.BOOL)),
                    () -> assertEquals("(fp.lt s7 s8)", render(TermExpression.of(Operator.LESS_THAN, f, g), Kind.BOOL)),
                    () -> assertEquals("(not (fp.eq s7 s8))", render(TermExpression.of(Operator.NOT_EQUAL, f, g), Kind.BOOL)),
                    () -> assertEquals("(distinct s0 s1)", render(TermExpression.of(Operator.NOT_EQUAL, a8, b8), Kind.BOOL)),
                    () -> assertEquals("(- s6)", render(TermExpression.of(Operator.NEGATE, r), Kind.REAL)),
                    () -> assertEquals("(and s10 s11)", render(TermExpression.of(Operator.AND, p, q), Kind.BOOL)),
                    () -> assertEquals("(bvxor s0 s1)", render(TermExpression.of(Operator.XOR, a8, b8), WORD8)),
                    () -> assertEquals("(ite s10 s0 s1)", render(TermExpression.of(Operator.ITE, p, a8, b8), WORD8))
            );
        }

        @Test
        @DisplayName("带参数的位运算")
        void testParameterizedBitOperations() {
            SymRef a8 = SymRef.of(0, WORD8);
            SymRef s8 = SymRef.of(2, INT8);
            SymRef b8 = SymRef.of(1, WORD8);

            assertAll("Shifts, rotations, extraction and concatenation",
                    () -> assertEquals("(bvshl s0 #x03)", render(TermExpression.withParameters(Operator.SHIFT_LEFT, List.of(3), a8), WORD8)),
                    () -> assertEquals("(bvlshr s0 #x01)", render(TermExpression.withParameters(Operator.SHIFT_RIGHT, List.of(1), a8), WORD8)),
                    () -> assertEquals("(bvashr s2 #x01)", render(TermExpression.withParameters(Operator.SHIFT_RIGHT, List.of(1), s8), INT8)),
                    () -> assertEquals("((_ rotate_left 2) s0)", render(TermExpression.withParameters(Operator.ROTATE_LEFT, List.of(2), a8), WORD8)),
                    () -> assertEquals("((_ extract 7 4) s0)", render(TermExpression.withParameters(Operator.EXTRACT, List.of(7, 4), a8), Kind.unsigned(4))),
                    () -> assertEquals("(concat s0 s1)", render(TermExpression.of(Operator.JOIN, a8, b8), Kind.unsigned(16)))
            );
        }

        @Test
        @DisplayName("表查找越界时取默认值")
        void testLookupWithDefault() {
            SymRef idx = SymRef.of(0, WORD8);
            SymRef dflt = SymRef.of(1, Kind.UNBOUNDED);
            SymRef e = SymRef.of(2, Kind.UNBOUNDED);
            SymRef target = SymRef.of(9, Kind.UNBOUNDED);
            ProblemDescriptor problem = ProblemDescriptor.builder()
                    .table(LookupTable.of(0, WORD8, Kind.UNBOUNDED, List.of(e, e, e)))
                    .assignment(Assignment.of(target, TermExpression.onTarget(Operator.LOOKUP, "table0", idx, dflt)))
                    .output(SymRef.TRUE_REF)
                    .config(z3)
                    .build();
            assertTrue(lines(converter.convert(problem).getLeft())
                    .contains("(define-fun s9 () Int (ite (bvult s0 #x03) (table0 s0) s1))"));
        }

        @Test
        @DisplayName("表长超出下标类型的正数范围时不写上界")
        void testLookupCoveringIndexRange() {
            SymRef dflt = SymRef.of(1, Kind.UNBOUNDED);
            SymRef e = SymRef.of(2, Kind.UNBOUNDED);
            List<SymRef> entries128 = Collections.nCopies(128, e);
            List<SymRef> entries256 = Collections.nCopies(256, e);

            SymRef signedIdx = SymRef.of(0, INT8);
            ProblemDescriptor signedProblem = ProblemDescriptor.builder()
                    .table(LookupTable.of(0, INT8, Kind.UNBOUNDED, entries128))
                    .assignment(Assignment.of(SymRef.of(9, Kind.UNBOUNDED),
                            TermExpression.onTarget(Operator.LOOKUP, "table0", signedIdx, dflt)))
                    .output(SymRef.TRUE_REF)
                    .config(z3)
                    .build();
            SymRef unsignedIdx = SymRef.of(0, WORD8);
            ProblemDescriptor unsignedProblem = ProblemDescriptor.builder()
                    .table(LookupTable.of(0, WORD8, Kind.UNBOUNDED, entries256))
                    .assignment(Assignment.of(SymRef.of(9, Kind.UNBOUNDED),
                            TermExpression.onTarget(Operator.LOOKUP, "table0", unsignedIdx, dflt)))
                    .output(SymRef.TRUE_REF)
                    .config(z3)
                    .build();
            SymRef smallIdx = SymRef.of(0, INT8);
            ProblemDescriptor smallProblem = ProblemDescriptor.builder()
                    .table(LookupTable.of(0, INT8, Kind.UNBOUNDED, Collections.nCopies(127, e)))
                    .assignment(Assignment.of(SymRef.of(9, Kind.UNBOUNDED),
                            TermExpression.onTarget(Operator.LOOKUP, "table0", smallIdx, dflt)))
                    .output(SymRef.TRUE_REF)
                    .config(z3)
                    .build();

            assertAll(
                    () -> assertTrue(lines(converter.convert(signedProblem).getLeft())
                            .contains("(define-fun s9 () Int (ite (bvsle #x00 s0) (table0 s0) s1))")),
                    () -> assertTrue(lines(converter.convert(unsignedProblem).getLeft())
                            .contains("(define-fun s9 () Int (table0 s0))")),
                    () -> assertTrue(lines(converter.convert(smallProblem).getLeft())
                            .contains("(define-fun s9 () Int (ite (and (bvsle #x00 s0) (bvslt s0 #x7f)) (table0 s0) s1))"))
            );
        }

        @Test
        @DisplayName("数组读取与未解释函数调用")
        void testArrayAndUninterpreted() {
            SymRef idx = SymRef.of(0, WORD8);
            assertAll(
                    () -> assertEquals("(select array_1 s0)",
                            render(TermExpression.onTarget(Operator.READ_ARRAY, "array_1", idx), WORD8)),
                    () -> assertEquals("(f s0)",
                            render(TermExpression.onTarget(Operator.UNINTERPRETED, "f", idx), Kind.UNBOUNDED)),
                    () -> assertEquals("k",
                            render(TermExpression.onTarget(Operator.UNINTERPRETED, "k"), WORD8))
            );
        }

        @Test
        @DisplayName("没有对应写法的组合抛出异常")
        void testUnsupportedCombination() {
            SymRef i = SymRef.of(4, Kind.UNBOUNDED);
            SymRef r = SymRef.of(6, Kind.REAL);
            SmtLibException e = assertThrows(SmtLibException.class,
                    () -> render(TermExpression.of(Operator.AND, i, i), Kind.UNBOUNDED));
            assertTrue(e.getMessage().contains("AND") && e.getMessage().contains("SInteger"));
            assertThrows(SmtLibException.class,
                    () -> render(TermExpression.withParameters(Operator.EXTRACT, List.of(3, 0), r), Kind.unsigned(4)));
        }
    }
}
