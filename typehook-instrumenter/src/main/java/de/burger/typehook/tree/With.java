package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record With(List<WithItem> items, List<Stmt> body, boolean async, SourcePosition position) implements Stmt {

    public With {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        Objects.requireNonNull(position, "position");
    }

    public With withBody(List<Stmt> newBody) {
        return new With(items, newBody, async, position);
    }
}
