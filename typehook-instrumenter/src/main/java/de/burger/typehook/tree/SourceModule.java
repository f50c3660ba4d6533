package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/** Module root: the top-level statement sequence of one source file. */
public record SourceModule(List<Stmt> body, SourcePosition position) implements Node {

    public SourceModule {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        Objects.requireNonNull(position, "position");
    }

    public SourceModule withBody(List<Stmt> newBody) {
        return new SourceModule(newBody, position);
    }
}
