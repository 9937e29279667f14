package org.carball.router.parser;

import net.sf.jsqlparser.statement.Statement;

/**
 * AST rewrite step run before predicates are extracted. Implementations must be
 * idempotent and must not change query semantics.
 */
public interface QueryOptimizer {

    Statement optimize(Statement statement);
}
