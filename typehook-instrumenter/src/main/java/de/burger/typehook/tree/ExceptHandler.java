package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/** {@code except type as name: body}; {@code type} and {@code name} may be {@code null}. */
public record ExceptHandler(Expr type, String name, List<Stmt> body, SourcePosition position) {

    public ExceptHandler {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        Objects.requireNonNull(position, "position");
    }

    public ExceptHandler withBody(List<Stmt> newBody) {
        return new ExceptHandler(type, name, newBody, position);
    }
}
