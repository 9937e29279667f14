package org.carball.router.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.carball.router.exception.ErrorKind;
import org.carball.router.exception.RouterException;
import org.carball.router.model.query.NormalizedQuery;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * JSqlParser-backed front end: parse, optimize, canonicalize, extract predicates.
 */
@Slf4j
public class SqlQueryParser implements QueryParser {

    private final QueryOptimizer optimizer;

    public SqlQueryParser() {
        this(new NoOpQueryOptimizer());
    }

    public SqlQueryParser(QueryOptimizer optimizer) {
        this.optimizer = optimizer;
    }

    @Override
    public NormalizedQuery parse(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new RouterException(ErrorKind.INVALID_QUERY, "Query text is empty");
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(stripTrailingSemicolons(sql));
        } catch (JSQLParserException e) {
            log.error("Error parsing query: {}", e.getMessage());
            throw new RouterException(ErrorKind.INVALID_QUERY, "Invalid SQL: " + e.getMessage(), e);
        }
        if (!(statement instanceof Select)) {
            throw new RouterException(ErrorKind.INVALID_QUERY,
                    "Only SELECT queries can be routed, got " + statement.getClass().getSimpleName());
        }

        Statement optimized = optimizer.optimize(statement);
        String canonical = canonicalize(optimized.toString());
        List<String> tables = SelectWalker.tableNames(optimized);

        PredicateExtractor.Extraction extraction;
        if (optimized instanceof PlainSelect plainSelect && plainSelect.getFromItem() instanceof Table
                && (plainSelect.getWithItemsList() == null || plainSelect.getWithItemsList().isEmpty())
                && !readsTableAgain(plainSelect)) {
            extraction = new PredicateExtractor(mainTableNames(plainSelect)).extract(plainSelect.getWhere());
        } else {
            // Set operations, CTEs, derived tables and second reads of the dataset (self-joins,
            // subqueries): outer filters say nothing exact about the files every reader needs
            extraction = new PredicateExtractor.Extraction(List.of(), true);
        }

        log.debug("Parsed query over {} with {} predicate(s){}", tables, extraction.predicates().size(),
                extraction.complex() ? " (complex filter)" : "");
        return new NormalizedQuery(optimized, canonical, extraction.predicates(), tables, extraction.complex());
    }

    /**
     * Deterministic text form: the parser's own rendering with whitespace
     * collapsed, so formatting differences do not change the fingerprint.
     */
    static String canonicalize(String sql) {
        return stripTrailingSemicolons(sql.replaceAll("\\s+", " ").trim());
    }

    private static String stripTrailingSemicolons(String sql) {
        String result = sql.trim();
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    /**
     * True when the dataset behind the FROM table is read a second time, by a
     * join or by a subquery anywhere in the select list, join conditions,
     * WHERE or HAVING. Unrecognized join sources count as a second read.
     */
    static boolean readsTableAgain(PlainSelect plainSelect) {
        try {
            return findsSecondRead(plainSelect);
        } catch (UnsupportedOperationException e) {
            log.debug("Could not list tables of {}, not pruning: {}", plainSelect, e.getMessage());
            return true;
        }
    }

    private static boolean findsSecondRead(PlainSelect plainSelect) {
        String dataset = baseName(((Table) plainSelect.getFromItem()).getFullyQualifiedName());
        List<Expression> expressions = new ArrayList<>();

        if (plainSelect.getJoins() != null) {
            for (Join join : plainSelect.getJoins()) {
                FromItem right = join.getRightItem();
                if (right instanceof Table table) {
                    if (dataset.equals(baseName(table.getFullyQualifiedName()))) {
                        return true;
                    }
                } else if (right instanceof Select select) {
                    if (namesDataset(tablesIn(select), dataset)) {
                        return true;
                    }
                } else {
                    return true;
                }
                if (join.getOnExpressions() != null) {
                    expressions.addAll(join.getOnExpressions());
                }
            }
        }
        if (plainSelect.getSelectItems() != null) {
            for (SelectItem<?> item : plainSelect.getSelectItems()) {
                expressions.add(item.getExpression());
            }
        }
        expressions.add(plainSelect.getWhere());
        expressions.add(plainSelect.getHaving());

        for (Expression expression : expressions) {
            if (expression != null && namesDataset(tablesIn(expression), dataset)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> tablesIn(Select select) {
        return new TablesNamesFinder().getTables((Statement) select);
    }

    private static Set<String> tablesIn(Expression expression) {
        return new TablesNamesFinder().getTables(expression);
    }

    private static boolean namesDataset(Set<String> tables, String dataset) {
        return tables.stream().anyMatch(name -> dataset.equals(baseName(name)));
    }

    /**
     * Last segment of a possibly qualified, possibly quoted table name, lower-cased.
     */
    private static String baseName(String qualifiedName) {
        String name = qualifiedName == null ? "" : qualifiedName;
        int dot = name.lastIndexOf('.');
        return SqlIdentifiers.unquote(name.substring(dot + 1)).toLowerCase(Locale.ROOT);
    }

    private static Set<String> mainTableNames(PlainSelect plainSelect) {
        Set<String> names = new HashSet<>();
        if (plainSelect.getFromItem() instanceof Table table) {
            names.add(SqlIdentifiers.unquote(table.getName()).toLowerCase(Locale.ROOT));
            if (table.getFullyQualifiedName() != null) {
                names.add(table.getFullyQualifiedName().toLowerCase(Locale.ROOT));
            }
            if (table.getAlias() != null) {
                names.add(SqlIdentifiers.unquote(table.getAlias().getName()).toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }
}
