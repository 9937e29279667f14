package org.carball.router.parser;

final class SqlIdentifiers {

    private SqlIdentifiers() {
        // Utility class - prevent instantiation
    }

    static String unquote(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            return identifier;
        }
        char first = identifier.charAt(0);
        char last = identifier.charAt(identifier.length() - 1);
        if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
            return identifier.substring(1, identifier.length() - 1);
        }
        return identifier;
    }

    /**
     * Single-quoted literal body without the quotes, e.g. {@code '2024-11-01'} to {@code 2024-11-01}.
     */
    static String stripQuotes(String literal) {
        String trimmed = literal.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
