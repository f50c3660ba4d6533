package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record Assign(List<Expr> targets, Expr value, SourcePosition position) implements Stmt {

    public Assign {
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }
}
