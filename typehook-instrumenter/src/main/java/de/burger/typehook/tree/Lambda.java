package de.burger.typehook.tree;

import java.util.Objects;

/** Anonymous function expression. Lambdas cannot carry annotations and open no named scope. */
public record Lambda(Arguments args, Expr body, SourcePosition position) implements Expr {

    public Lambda {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(position, "position");
    }
}
