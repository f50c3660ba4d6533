package de.burger.typehook.tree;

import java.util.Objects;

public record Name(String id, SourcePosition position) implements Expr {

    public Name {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(position, "position");
    }
}
