package org.smtbridge.core;

/**
 * 输入变量的量词极性。
 */
public enum Quantifier {
    EX("exists"),
    ALL("forall");

    private final String symbol;

    Quantifier(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
