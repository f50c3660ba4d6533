package de.burger.typehook.tree;

import java.util.Objects;

/** {@code name=value} in a call or class header. */
public record Keyword(String name, Expr value) {

    public Keyword {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
