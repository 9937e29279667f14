package org.carball.router.model.query;

/**
 * Type of a literal as written in the query. STRING literals are untyped:
 * the pruner tries every interpretation they admit.
 */
public enum LiteralType {
    STRING,
    NUMBER,
    DATE,
    TIMESTAMP,
    BOOLEAN
}
