package de.burger.typehook.tree;

import java.util.Objects;

public record Pass(SourcePosition position) implements Stmt {

    public Pass {
        Objects.requireNonNull(position, "position");
    }
}
