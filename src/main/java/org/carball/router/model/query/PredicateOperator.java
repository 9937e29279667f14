package org.carball.router.model.query;

public enum PredicateOperator {
    EQ("="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    IN("IN"),
    BETWEEN("BETWEEN");

    private final String symbol;

    PredicateOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Operator to use when the operands of a binary comparison are swapped,
     * e.g. {@code '2024-11-01' <= date} becomes {@code date >= '2024-11-01'}.
     */
    public PredicateOperator mirrored() {
        switch (this) {
            case LT:
                return GT;
            case LTE:
                return GTE;
            case GT:
                return LT;
            case GTE:
                return LTE;
            default:
                return this;
        }
    }

    public int expectedOperands() {
        switch (this) {
            case IN:
                return -1;
            case BETWEEN:
                return 2;
            default:
                return 1;
        }
    }
}
