package de.burger.typehook.tree;

import java.util.Objects;

/** {@code value.attr}. */
public record Attribute(Expr value, String attr, SourcePosition position) implements Expr {

    public Attribute {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(attr, "attr");
        Objects.requireNonNull(position, "position");
    }
}
