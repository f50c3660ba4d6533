package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, boolean async, SourcePosition position)
    implements Stmt {

    public For {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(iter, "iter");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        orElse = List.copyOf(Objects.requireNonNull(orElse, "orElse"));
        Objects.requireNonNull(position, "position");
    }

    public For withBodies(List<Stmt> newBody, List<Stmt> newOrElse) {
        return new For(target, iter, newBody, newOrElse, async, position);
    }
}
