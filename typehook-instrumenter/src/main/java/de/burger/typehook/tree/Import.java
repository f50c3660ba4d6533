package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/** {@code import a.b as c, d}. */
public record Import(List<Alias> names, SourcePosition position) implements Stmt {

    public Import {
        names = List.copyOf(Objects.requireNonNull(names, "names"));
        Objects.requireNonNull(position, "position");
    }
}
