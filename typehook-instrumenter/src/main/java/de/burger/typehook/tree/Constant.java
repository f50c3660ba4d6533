package de.burger.typehook.tree;

import java.util.Objects;

/**
 * Literal value: {@link String}, {@link Number}, {@link Boolean}, or {@code null} for
 * {@code None}.
 */
public record Constant(Object value, SourcePosition position) implements Expr {

    public Constant {
        Objects.requireNonNull(position, "position");
        if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
    }

    public boolean isString() {
        return value instanceof String;
    }
}
