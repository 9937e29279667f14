package org.carball.router.model.query;

public record Literal(String value, LiteralType type) {

    public Literal {
        if (value == null) {
            throw new IllegalArgumentException("Literal value must not be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("Literal type must not be null");
        }
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal number(String value) {
        return new Literal(value, LiteralType.NUMBER);
    }

    public static Literal date(String value) {
        return new Literal(value, LiteralType.DATE);
    }

    @Override
    public String toString() {
        return type == LiteralType.NUMBER || type == LiteralType.BOOLEAN ? value : "'" + value + "'";
    }
}
