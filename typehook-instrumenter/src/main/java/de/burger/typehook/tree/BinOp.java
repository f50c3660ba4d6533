package de.burger.typehook.tree;

import java.util.Objects;

/** Binary operation; {@code operator} is the source token, e.g. {@code "|"} in {@code int | None}. */
public record BinOp(Expr left, String operator, Expr right, SourcePosition position) implements Expr {

    public BinOp {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(position, "position");
    }
}
