package org.carball.router.parser;

import net.sf.jsqlparser.statement.Statement;

public class NoOpQueryOptimizer implements QueryOptimizer {

    @Override
    public Statement optimize(Statement statement) {
        return statement;
    }
}
