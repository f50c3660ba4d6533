package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record While(Expr test, List<Stmt> body, List<Stmt> orElse, SourcePosition position) implements Stmt {

    public While {
        Objects.requireNonNull(test, "test");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        orElse = List.copyOf(Objects.requireNonNull(orElse, "orElse"));
        Objects.requireNonNull(position, "position");
    }

    public While withBodies(List<Stmt> newBody, List<Stmt> newOrElse) {
        return new While(test, newBody, newOrElse, position);
    }
}
