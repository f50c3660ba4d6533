package de.burger.typehook.tree;

import java.util.Objects;

/** {@code value[slice]}. */
public record Subscript(Expr value, Expr slice, SourcePosition position) implements Expr {

    public Subscript {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(slice, "slice");
        Objects.requireNonNull(position, "position");
    }
}
