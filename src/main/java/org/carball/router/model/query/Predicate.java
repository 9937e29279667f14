package org.carball.router.model.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A lowered WHERE-clause conjunct: {@code column operator literal(s)}.
 *
 * <p>Example: {@code date >= '2024-11-01'} is
 * {@code new Predicate("date", GTE, List.of(Literal.string("2024-11-01")))}.
 */
public record Predicate(
        String column,
        PredicateOperator operator,
        List<Literal> operands
) {

    public Predicate {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Predicate column must not be blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Predicate operator must not be null");
        }
        operands = List.copyOf(operands);
        int expected = operator.expectedOperands();
        if (expected < 0 ? operands.isEmpty() : operands.size() != expected) {
            throw new IllegalArgumentException("Operator " + operator.getSymbol()
                    + " got " + operands.size() + " operand(s) on column " + column);
        }
    }

    public static Predicate of(String column, PredicateOperator operator, Literal... operands) {
        return new Predicate(column, operator, List.of(operands));
    }

    public Literal operand() {
        return operands.get(0);
    }

    @Override
    public String toString() {
        switch (operator) {
            case IN:
                return column + " IN (" + operands.stream().map(Literal::toString)
                        .collect(Collectors.joining(", ")) + ")";
            case BETWEEN:
                return column + " BETWEEN " + operands.get(0) + " AND " + operands.get(1);
            default:
                return column + " " + operator.getSymbol() + " " + operand();
        }
    }
}
