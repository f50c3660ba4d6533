package de.burger.typehook.tree;

import java.util.Objects;

/** One parameter. {@code annotation} and {@code defaultValue} are {@code null} when absent. */
public record Arg(String name, Expr annotation, Expr defaultValue) {

    public Arg {
        Objects.requireNonNull(name, "name");
    }

    public static Arg of(String name) {
        return new Arg(name, null, null);
    }

    public static Arg of(String name, Expr annotation) {
        return new Arg(name, annotation, null);
    }

    public boolean isAnnotated() {
        return annotation != null;
    }
}
