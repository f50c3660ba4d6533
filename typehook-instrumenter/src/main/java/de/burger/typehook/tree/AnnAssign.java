package de.burger.typehook.tree;

import java.util.Objects;

/**
 * {@code target: annotation = value}. {@code value} is {@code null} for a bare annotation;
 * {@code simple} is true when the target is a plain, unparenthesized name.
 */
public record AnnAssign(Expr target, Expr annotation, Expr value, boolean simple, SourcePosition position)
    implements Stmt {

    public AnnAssign {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(annotation, "annotation");
        Objects.requireNonNull(position, "position");
    }
}
