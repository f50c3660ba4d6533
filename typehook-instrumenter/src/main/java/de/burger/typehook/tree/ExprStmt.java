package de.burger.typehook.tree;

import java.util.Objects;

/** Expression evaluated for its side effect (or a docstring). */
public record ExprStmt(Expr value, SourcePosition position) implements Stmt {

    public ExprStmt {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }
}
