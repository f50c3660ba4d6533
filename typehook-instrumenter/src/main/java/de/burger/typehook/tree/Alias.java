package de.burger.typehook.tree;

import java.util.Objects;

/** Imported name with an optional {@code as} rebinding. */
public record Alias(String name, String asName) {

    public Alias {
        Objects.requireNonNull(name, "name");
    }

    public static Alias of(String name) {
        return new Alias(name, null);
    }
}
