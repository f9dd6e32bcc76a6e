package com.metabuild.generator.model.expr;

/**
 * Operators of {@link BoolExpr}.
 */
public enum BoolOperator {
    AND("&&"),
    OR("||"),
    NOT("!"),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    BoolOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isUnary() {
        return this == NOT;
    }
}
