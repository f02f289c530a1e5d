package org.e2immu.analyzer.shape.cfg.statement;

public enum UnaryOperator {
    NOT("!"), MINUS("-");

    public final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }
}
