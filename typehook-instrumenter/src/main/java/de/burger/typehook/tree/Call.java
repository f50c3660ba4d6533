package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record Call(Expr func, List<Expr> args, List<Keyword> keywords, SourcePosition position) implements Expr {

    public Call {
        Objects.requireNonNull(func, "func");
        args = List.copyOf(Objects.requireNonNull(args, "args"));
        keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
        Objects.requireNonNull(position, "position");
    }
}
