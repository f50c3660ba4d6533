package de.burger.typehook.tree;

import java.util.Objects;

public record Return(Expr value, SourcePosition position) implements Stmt {

    public Return {
        Objects.requireNonNull(position, "position");
    }
}
