package de.burger.typehook.tree;

import java.util.Objects;

/** {@code context as optionalVars}; {@code optionalVars} may be {@code null}. */
public record WithItem(Expr context, Expr optionalVars) {

    public WithItem {
        Objects.requireNonNull(context, "context");
    }
}
