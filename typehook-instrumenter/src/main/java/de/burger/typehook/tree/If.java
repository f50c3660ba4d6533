package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record If(Expr test, List<Stmt> body, List<Stmt> orElse, SourcePosition position) implements Stmt {

    public If {
        Objects.requireNonNull(test, "test");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        orElse = List.copyOf(Objects.requireNonNull(orElse, "orElse"));
        Objects.requireNonNull(position, "position");
    }

    public If withBodies(List<Stmt> newBody, List<Stmt> newOrElse) {
        return new If(test, newBody, newOrElse, position);
    }
}
