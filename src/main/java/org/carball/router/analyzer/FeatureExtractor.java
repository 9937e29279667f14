package org.carball.router.analyzer;

import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.carball.router.model.query.NormalizedQuery;
import org.carball.router.model.query.Predicate;
import org.carball.router.model.query.QueryFeatures;
import org.carball.router.parser.SelectWalker;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the query shape the cost model needs from the normalized AST.
 * Pure: the same query and volume always give the same features.
 */
public class FeatureExtractor {

    private static final Set<String> AGGREGATE_FUNCTIONS = Set.of(
            "COUNT", "SUM", "AVG", "MIN", "MAX", "MEDIAN",
            "STDDEV", "STDDEV_POP", "STDDEV_SAMP", "VARIANCE", "VAR_POP", "VAR_SAMP",
            "ARRAY_AGG", "STRING_AGG", "GROUP_CONCAT", "LISTAGG",
            "APPROX_COUNT_DISTINCT", "COUNT_DISTINCT", "ANY_VALUE", "FIRST", "LAST");

    private final int averageRowWidthBytes;
    private final double aggregationReductionFactor;

    public FeatureExtractor(int averageRowWidthBytes, double aggregationReductionFactor) {
        if (averageRowWidthBytes <= 0) {
            throw new IllegalArgumentException("Average row width must be positive: " + averageRowWidthBytes);
        }
        this.averageRowWidthBytes = averageRowWidthBytes;
        this.aggregationReductionFactor = aggregationReductionFactor;
    }

    public QueryFeatures extract(NormalizedQuery query, long prunedBytes) {
        ShapeCounter counter = new ShapeCounter();
        int joins = 0;
        boolean distinct = false;
        boolean groupBy = false;

        for (PlainSelect select : SelectWalker.plainSelects(query.statement())) {
            List<Join> selectJoins = select.getJoins();
            if (selectJoins != null) {
                joins += selectJoins.size();
            }
            distinct |= select.getDistinct() != null;
            groupBy |= select.getGroupBy() != null;

            if (select.getSelectItems() != null) {
                for (SelectItem<?> item : select.getSelectItems()) {
                    visit(item.getExpression(), counter);
                }
            }
            visit(select.getHaving(), counter);
            if (select.getOrderByElements() != null) {
                for (OrderByElement orderBy : select.getOrderByElements()) {
                    visit(orderBy.getExpression(), counter);
                }
            }
        }

        long filterColumns = query.predicates().stream()
                .map(Predicate::column)
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet())
                .size();

        return QueryFeatures.builder()
                .numJoins(joins)
                .numAggregations(counter.aggregations)
                .distinct(distinct || counter.distinctAggregate)
                .windowFunctions(counter.windows > 0)
                .groupBy(groupBy)
                .filterColumns((int) filterColumns)
                .estimatedRows(estimateRows(prunedBytes, groupBy))
                .build();
    }

    /**
     * {@code max(1, bytes / rowWidth)}, scaled by the reduction factor when grouping.
     */
    long estimateRows(long prunedBytes, boolean groupBy) {
        long scanned = Math.max(1, prunedBytes / averageRowWidthBytes);
        if (!groupBy) {
            return scanned;
        }
        return Math.max(1, (long) Math.floor(scanned * aggregationReductionFactor));
    }

    private static void visit(Expression expression, ShapeCounter counter) {
        if (expression != null) {
            expression.accept(counter);
        }
    }

    private static final class ShapeCounter extends ExpressionVisitorAdapter {
        private int aggregations;
        private int windows;
        private boolean distinctAggregate;

        @Override
        public void visit(Function function) {
            if (function.getName() != null
                    && AGGREGATE_FUNCTIONS.contains(function.getName().toUpperCase(Locale.ROOT))) {
                aggregations++;
                distinctAggregate |= function.isDistinct();
            }
            super.visit(function);
        }

        @Override
        public void visit(AnalyticExpression expression) {
            windows++;
            super.visit(expression);
        }
    }
}
