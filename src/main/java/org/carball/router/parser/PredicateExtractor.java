package org.carball.router.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.DateTimeLiteralExpression;
import net.sf.jsqlparser.expression.DateValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimestampValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ComparisonOperator;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.expression.operators.relational.NotEqualsTo;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import org.carball.router.model.query.Literal;
import org.carball.router.model.query.LiteralType;
import org.carball.router.model.query.Predicate;
import org.carball.router.model.query.PredicateOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a WHERE clause to conjunctive {@code column op literal} predicates.
 *
 * <p>Only AND chains are flattened. OR, NOT, NOT IN, NOT BETWEEN and comparisons
 * that are not column-against-literal stay un-lowered and flag the filter as
 * complex; pruning then simply has less to work with.
 */
@Slf4j
public class PredicateExtractor {

    /**
     * Predicates found in a WHERE clause and whether anything was left behind.
     */
    public record Extraction(List<Predicate> predicates, boolean complex) {
    }

    private final Set<String> mainTableNames;

    /**
     * @param mainTableNames lower-cased name and alias of the scanned table; a
     *                       column qualified with any other table is not lowered
     */
    public PredicateExtractor(Set<String> mainTableNames) {
        this.mainTableNames = mainTableNames;
    }

    public Extraction extract(Expression where) {
        List<Predicate> predicates = new ArrayList<>();
        if (where == null) {
            return new Extraction(predicates, false);
        }
        boolean complete = visit(where, predicates);
        return new Extraction(predicates, !complete);
    }

    /**
     * @return false if some part of the expression could not be lowered
     */
    private boolean visit(Expression expression, List<Predicate> predicates) {
        if (expression instanceof AndExpression and) {
            boolean left = visit(and.getLeftExpression(), predicates);
            boolean right = visit(and.getRightExpression(), predicates);
            return left && right;
        }
        if (expression instanceof ParenthesedExpressionList<?> parenthesed && parenthesed.size() == 1) {
            return visit(parenthesed.get(0), predicates);
        }
        if (expression instanceof ComparisonOperator comparison) {
            return lowerComparison(comparison).map(predicates::add).orElse(false);
        }
        if (expression instanceof InExpression in) {
            return lowerIn(in).map(predicates::add).orElse(false);
        }
        if (expression instanceof Between between) {
            return lowerBetween(between).map(predicates::add).orElse(false);
        }
        log.debug("Leaving filter expression un-lowered: {}", expression);
        return false;
    }

    private Optional<Predicate> lowerComparison(ComparisonOperator comparison) {
        Optional<PredicateOperator> operator = operatorOf(comparison);
        if (operator.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> column = columnName(comparison.getLeftExpression());
        Optional<Literal> literal = literal(comparison.getRightExpression());
        if (column.isPresent() && literal.isPresent()) {
            return Optional.of(Predicate.of(column.get(), operator.get(), literal.get()));
        }
        column = columnName(comparison.getRightExpression());
        literal = literal(comparison.getLeftExpression());
        if (column.isPresent() && literal.isPresent()) {
            return Optional.of(Predicate.of(column.get(), operator.get().mirrored(), literal.get()));
        }
        return Optional.empty();
    }

    private Optional<Predicate> lowerIn(InExpression in) {
        if (in.isNot()) {
            return Optional.empty();
        }
        Optional<String> column = columnName(in.getLeftExpression());
        if (column.isEmpty() || !(in.getRightExpression() instanceof ExpressionList<?> values) || values.isEmpty()) {
            return Optional.empty();
        }
        List<Literal> literals = new ArrayList<>();
        for (Expression value : values) {
            Optional<Literal> literal = literal(value);
            if (literal.isEmpty()) {
                return Optional.empty();
            }
            literals.add(literal.get());
        }
        return Optional.of(new Predicate(column.get(), PredicateOperator.IN, literals));
    }

    private Optional<Predicate> lowerBetween(Between between) {
        if (between.isNot()) {
            return Optional.empty();
        }
        Optional<String> column = columnName(between.getLeftExpression());
        Optional<Literal> low = literal(between.getBetweenExpressionStart());
        Optional<Literal> high = literal(between.getBetweenExpressionEnd());
        if (column.isEmpty() || low.isEmpty() || high.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Predicate.of(column.get(), PredicateOperator.BETWEEN, low.get(), high.get()));
    }

    private static Optional<PredicateOperator> operatorOf(ComparisonOperator comparison) {
        if (comparison instanceof EqualsTo) {
            return Optional.of(PredicateOperator.EQ);
        } else if (comparison instanceof NotEqualsTo) {
            return Optional.of(PredicateOperator.NEQ);
        } else if (comparison instanceof GreaterThan) {
            return Optional.of(PredicateOperator.GT);
        } else if (comparison instanceof GreaterThanEquals) {
            return Optional.of(PredicateOperator.GTE);
        } else if (comparison instanceof MinorThan) {
            return Optional.of(PredicateOperator.LT);
        } else if (comparison instanceof MinorThanEquals) {
            return Optional.of(PredicateOperator.LTE);
        }
        return Optional.empty();
    }

    private Optional<String> columnName(Expression expression) {
        if (!(expression instanceof Column column)) {
            return Optional.empty();
        }
        Table qualifier = column.getTable();
        if (qualifier != null && qualifier.getName() != null && !mainTableNames.isEmpty()
                && !mainTableNames.contains(SqlIdentifiers.unquote(qualifier.getName()).toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(SqlIdentifiers.unquote(column.getColumnName()));
    }

    static Optional<Literal> literal(Expression expression) {
        if (expression instanceof StringValue string) {
            return Optional.of(Literal.string(string.getValue()));
        }
        if (expression instanceof LongValue longValue) {
            return Optional.of(Literal.number(longValue.getStringValue()));
        }
        if (expression instanceof DoubleValue doubleValue) {
            return Optional.of(Literal.number(doubleValue.toString()));
        }
        if (expression instanceof SignedExpression signed && signed.getSign() == '-') {
            return literal(signed.getExpression())
                    .filter(inner -> inner.type() == LiteralType.NUMBER)
                    .map(inner -> Literal.number("-" + inner.value()));
        }
        if (expression instanceof DateValue date) {
            return Optional.of(Literal.date(date.getValue().toString()));
        }
        if (expression instanceof TimestampValue timestamp) {
            return Optional.of(new Literal(timestamp.getValue().toString(), LiteralType.TIMESTAMP));
        }
        if (expression instanceof DateTimeLiteralExpression dateTime) {
            String value = SqlIdentifiers.stripQuotes(dateTime.getValue());
            String type = dateTime.getType().name();
            if ("DATE".equals(type)) {
                return Optional.of(Literal.date(value));
            }
            if (type.startsWith("TIMESTAMP")) {
                return Optional.of(new Literal(value, LiteralType.TIMESTAMP));
            }
            return Optional.empty();
        }
        if (expression instanceof CastExpression cast && cast.getColDataType() != null) {
            Optional<Literal> inner = literal(cast.getLeftExpression());
            String dataType = cast.getColDataType().getDataType().toUpperCase(Locale.ROOT);
            return inner.flatMap(value -> castLiteral(value, dataType));
        }
        return Optional.empty();
    }

    private static Optional<Literal> castLiteral(Literal literal, String dataType) {
        if (dataType.startsWith("DATE") && !dataType.startsWith("DATETIME")) {
            return Optional.of(Literal.date(literal.value()));
        }
        if (dataType.startsWith("TIMESTAMP") || dataType.startsWith("DATETIME")) {
            return Optional.of(new Literal(literal.value(), LiteralType.TIMESTAMP));
        }
        if (dataType.contains("INT") || dataType.startsWith("DECIMAL") || dataType.startsWith("NUMERIC")
                || dataType.startsWith("DOUBLE") || dataType.startsWith("FLOAT") || dataType.startsWith("REAL")) {
            return Optional.of(Literal.number(literal.value()));
        }
        if (dataType.contains("CHAR") || dataType.startsWith("STRING") || dataType.startsWith("TEXT")) {
            return Optional.of(Literal.string(literal.value()));
        }
        if (dataType.startsWith("BOOL")) {
            return Optional.of(new Literal(literal.value(), LiteralType.BOOLEAN));
        }
        return Optional.empty();
    }
}
