package org.e2immu.analyzer.shape.cfg.statement;

public enum BinaryOperator {
    ADD("+", false, false),
    SUB("-", false, false),
    MUL("*", false, false),
    EQ("==", true, false),
    NE("!=", true, false),
    LT("<", true, false),
    LE("<=", true, false),
    GT(">", true, false),
    GE(">=", true, false),
    AND("&&", false, true),
    OR("||", false, true);

    public final String symbol;
    public final boolean comparison;
    public final boolean logical;

    BinaryOperator(String symbol, boolean comparison, boolean logical) {
        this.symbol = symbol;
        this.comparison = comparison;
        this.logical = logical;
    }
}
