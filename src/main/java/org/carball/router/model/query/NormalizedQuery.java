package org.carball.router.model.query;

import net.sf.jsqlparser.statement.Statement;

import java.util.List;

/**
 * What the SQL front end hands to the router: the rewritten AST, a canonical
 * text form used for fingerprinting, and the lowered WHERE-clause predicates.
 *
 * @param statement     normalized AST
 * @param canonicalSql  deterministic text form of {@code statement}
 * @param predicates    conjunctive predicates in WHERE-clause order
 * @param tables        tables referenced by the query
 * @param complexFilter true when part of the WHERE clause (OR, NOT, subquery
 *                      comparisons) could not be lowered to predicates
 */
public record NormalizedQuery(
        Statement statement,
        String canonicalSql,
        List<Predicate> predicates,
        List<String> tables,
        boolean complexFilter
) {

    public NormalizedQuery {
        if (statement == null) {
            throw new IllegalArgumentException("Normalized query needs a statement");
        }
        if (canonicalSql == null || canonicalSql.isBlank()) {
            throw new IllegalArgumentException("Normalized query needs canonical text");
        }
        predicates = List.copyOf(predicates);
        tables = List.copyOf(tables);
    }
}
