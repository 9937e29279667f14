package org.carball.router.parser;

import org.carball.router.model.query.NormalizedQuery;

/**
 * Turns SQL text into the normalized form the router works on.
 */
public interface QueryParser {

    NormalizedQuery parse(String sql);
}
