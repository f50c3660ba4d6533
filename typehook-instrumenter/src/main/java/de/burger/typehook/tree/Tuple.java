package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record Tuple(List<Expr> elements, SourcePosition position) implements Expr {

    public Tuple {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        Objects.requireNonNull(position, "position");
    }
}
