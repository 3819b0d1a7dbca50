package org.smtbridge.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SolverCapabilitiesTest {

    @Test
    @DisplayName("从 properties 文件读取特性表")
    void testFromProperties() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/solvers/cvc4.properties")) {
            assertNotNull(in, "Test resource should exist");
            properties.load(in);
        }
        SolverCapabilities caps = SolverCapabilities.fromProperties(properties);
        assertEquals(KnownSolver.CVC4.getCapabilities(), caps);
    }

    @Test
    @DisplayName("缺失的布尔键视为不支持，缺少名字则报错")
    void testMissingKeys() {
        Properties properties = new Properties();
        properties.setProperty("name", "  mini ");
        properties.setProperty("reals", "TRUE");
        SolverCapabilities caps = SolverCapabilities.fromProperties(properties);
        assertAll(
                () -> assertEquals("mini", caps.getSolverName()),
                () -> assertTrue(caps.supportsReals()),
                () -> assertFalse(caps.supportsUnboundedInts()),
                () -> assertFalse(caps.supportsOptimization())
        );
        assertThrows(IllegalArgumentException.class, () -> SolverCapabilities.fromProperties(new Properties()));
    }

    @Test
    @DisplayName("预置的求解器特性表")
    void testKnownSolvers() {
        SolverCapabilities z3 = KnownSolver.Z3.getCapabilities();
        SolverCapabilities boolector = KnownSolver.BOOLECTOR.getCapabilities();
        assertAll(
                () -> assertTrue(z3.supportsOptimization() && z3.supportsQuantifiers() && z3.supportsDoubles()),
                () -> assertEquals(SolverCapabilities.none("Boolector"), boolector),
                () -> assertFalse(KnownSolver.YICES.getCapabilities().supportsQuantifiers()),
                () -> assertTrue(KnownSolver.MATHSAT.getCapabilities().supportsFloats())
        );
    }

    @Test
    @DisplayName("配置的默认值与复制")
    void testConfig() {
        SmtConfig config = SmtConfig.of(KnownSolver.Z3);
        SmtConfig custom = config.withSatCommand("(check-sat-using smt)").withLogic("QF_LIA");
        assertAll(
                () -> assertEquals(SmtConfig.DEFAULT_SAT_COMMAND, config.getSatCommand()),
                () -> assertTrue(config.getLogic().isEmpty()),
                () -> assertEquals("(check-sat-using smt)", custom.getSatCommand()),
                () -> assertEquals("QF_LIA", custom.getLogic().orElseThrow()),
                () -> assertEquals("Z3", custom.getSolverName())
        );
    }
}
