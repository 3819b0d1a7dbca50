package org.smtbridge.smtlib;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymRef;
import org.smtbridge.problem.CaseCondition;
import org.smtbridge.problem.Objective;
import org.smtbridge.problem.OptimizeStyle;
import org.smtbridge.solver.KnownSolver;
import org.smtbridge.solver.SolverCapabilities;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityGateTest {

    private static SymRef x, y, z;
    private static SolverCapabilities everything;

    @BeforeAll
    static void setUp() {
        x = SymRef.of(0, Kind.UNBOUNDED);
        y = SymRef.of(1, Kind.UNBOUNDED);
        z = SymRef.of(2, Kind.UNBOUNDED);
        everything = KnownSolver.Z3.getCapabilities();
    }

    private static UnsupportedFeatureException gateFails(Set<Kind> kinds, SolverCapabilities caps) {
        return assertThrows(UnsupportedFeatureException.class,
                () -> CapabilityGate.check(kinds, true, List.of(), CaseCondition.none(), caps));
    }

    @Nested
    @DisplayName("单项特性检查 (Feature checks)")
    class FeatureTests {

        @Test
        @DisplayName("每一种缺失的特性都会被点名")
        void testEachMissingFeatureIsNamed() {
            SolverCapabilities none = SolverCapabilities.none("Boolector");
            assertAll("Each required feature names itself",
                    () -> assertEquals("unbounded integers", gateFails(Set.of(Kind.UNBOUNDED), none).getFeature()),
                    () -> assertEquals("algebraic reals", gateFails(Set.of(Kind.REAL), none).getFeature()),
                    () -> assertEquals("single-precision floating-point numbers", gateFails(Set.of(Kind.FLOAT), none).getFeature()),
                    () -> assertEquals("double-precision floating-point numbers", gateFails(Set.of(Kind.DOUBLE), none).getFeature()),
                    () -> assertEquals("uninterpreted sorts", gateFails(Set.of(Kind.userSort("Q")), none).getFeature())
            );
        }

        @Test
        @DisplayName("错误信息包含特性和求解器名")
        void testMessageNamesFeatureAndSolver() {
            UnsupportedFeatureException e = gateFails(Set.of(Kind.REAL), KnownSolver.ABC.getCapabilities());
            assertEquals("Given problem needs algebraic reals\n*** Which is not supported for the chosen solver: ABC",
                    e.getMessage());
        }

        @Test
        @DisplayName("按固定顺序检查，第一个失败的胜出")
        void testFirstFailureWins() {
            SolverCapabilities none = SolverCapabilities.none("none");
            UnsupportedFeatureException e = gateFails(Set.of(Kind.DOUBLE, Kind.REAL, Kind.UNBOUNDED), none);
            assertEquals("unbounded integers", e.getFeature());

            UnsupportedFeatureException e2 = gateFails(Set.of(Kind.DOUBLE, Kind.FLOAT), none);
            assertEquals("single-precision floating-point numbers", e2.getFeature());
        }

        @Test
        @DisplayName("位向量和布尔不需要任何特性")
        void testBitVectorsAlwaysPass() {
            assertDoesNotThrow(() -> CapabilityGate.check(Set.of(Kind.BOOL, Kind.unsigned(8), Kind.signed(32)), true,
                    List.of(), CaseCondition.none(), SolverCapabilities.none("ABC")));
        }

        @Test
        @DisplayName("全部支持时直接通过")
        void testEverythingSupported() {
            Set<Kind> kinds = Set.of(Kind.UNBOUNDED, Kind.REAL, Kind.FLOAT, Kind.DOUBLE, Kind.userSort("Q"));
            assertDoesNotThrow(() -> CapabilityGate.check(kinds, true, List.of(NamedSymVar.forall(x, "x")),
                    CaseCondition.optimize(OptimizeStyle.LEXICOGRAPHIC, List.of(Objective.maximize("goal", y, y))),
                    everything));
        }
    }

    @Nested
    @DisplayName("量词检查 (Quantifiers)")
    class QuantifierTests {

        private final SolverCapabilities noQuantifiers = KnownSolver.Z3.getCapabilities().withQuantifiers(false);

        @Test
        @DisplayName("求可满足性时全称输入需要量词")
        void testUniversalInSatMode() {
            UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
                    () -> CapabilityGate.check(Set.of(), true, List.of(NamedSymVar.forall(x, "x")),
                            CaseCondition.none(), noQuantifiers));
            assertEquals("quantifiers", e.getFeature());
        }

        @Test
        @DisplayName("求可满足性时只有存在输入则不需要量词")
        void testExistentialInSatMode() {
            assertDoesNotThrow(() -> CapabilityGate.check(Set.of(), true, List.of(NamedSymVar.exists(x, "x")),
                    CaseCondition.none(), noQuantifiers));
        }

        @Test
        @DisplayName("证明时存在输入需要量词")
        void testExistentialInProveMode() {
            assertThrows(UnsupportedFeatureException.class,
                    () -> CapabilityGate.check(Set.of(), false, List.of(NamedSymVar.exists(x, "x")),
                            CaseCondition.none(), noQuantifiers));
            assertDoesNotThrow(() -> CapabilityGate.check(Set.of(), false, List.of(NamedSymVar.forall(x, "x")),
                    CaseCondition.none(), noQuantifiers));
        }
    }

    @Nested
    @DisplayName("优化检查 (Optimization)")
    class OptimizationTests {

        @Test
        @DisplayName("求解器不支持优化")
        void testOptimizationUnsupported() {
            CaseCondition opt = CaseCondition.optimize(OptimizeStyle.INDEPENDENT, List.of(Objective.minimize("cost", x, x)));
            UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
                    () -> CapabilityGate.check(Set.of(Kind.UNBOUNDED), true, List.of(NamedSymVar.exists(x, "x")),
                            opt, KnownSolver.CVC4.getCapabilities()));
            assertEquals("optimization routines", e.getFeature());
        }

        @Test
        @DisplayName("优化全称变量时列出所有违规目标")
        void testUniversalObjectivesAreCollected() {
            List<NamedSymVar> inputs = List.of(NamedSymVar.forall(x, "x"), NamedSymVar.exists(y, "y"),
                    NamedSymVar.forall(z, "z"));
            CaseCondition opt = CaseCondition.optimize(OptimizeStyle.LEXICOGRAPHIC, List.of(
                    Objective.maximize("first", x, x),
                    Objective.minimize("fine", y, y),
                    Objective.maximize("second", y, z)));
            UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
                    () -> CapabilityGate.check(Set.of(Kind.UNBOUNDED), true, inputs, opt, everything));
            assertAll(
                    () -> assertEquals("optimization of universally quantified metric(s): first second", e.getFeature()),
                    () -> assertTrue(e.getMessage().endsWith("*** Which is not supported.")),
                    () -> assertFalse(e.getMessage().contains("Z3"), "The aggregate check does not name the solver")
            );
        }
    }
}
