package org.smtbridge.solver;

/**
 * 已知求解器的默认特性表。
 */
public enum KnownSolver {

    //                 ints   reals  float  double quant  sorts  opt
    Z3("Z3",           true,  true,  true,  true,  true,  true,  true),
    CVC4("CVC4",       true,  true,  false, false, true,  true,  false),
    YICES("Yices",     true,  true,  false, false, false, true,  false),
    BOOLECTOR("Boolector", false, false, false, false, false, false, false),
    MATHSAT("MathSAT", true,  true,  true,  true,  false, true,  false),
    ABC("ABC",         false, false, false, false, false, false, false);

    private final SolverCapabilities capabilities;

    KnownSolver(String name, boolean ints, boolean reals, boolean floats, boolean doubles,
                boolean quantifiers, boolean sorts, boolean optimization) {
        this.capabilities = SolverCapabilities.of(name, ints, reals, floats, doubles, quantifiers, sorts, optimization);
    }

    public SolverCapabilities getCapabilities() {
        return capabilities;
    }
}
