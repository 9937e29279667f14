package org.carball.router.pruning;

/**
 * Outcome of checking one partition value against one predicate.
 * AMBIGUOUS means a coercion failed and the partition is kept.
 */
public enum MatchResult {
    MATCH,
    NO_MATCH,
    AMBIGUOUS;

    public boolean excludes() {
        return this == NO_MATCH;
    }
}
