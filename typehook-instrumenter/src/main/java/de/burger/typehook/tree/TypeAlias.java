package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/**
 * {@code type name[typeParams] = value}. The value is evaluated lazily at runtime, so it may
 * refer to names defined further down the module.
 */
public record TypeAlias(Name name, List<Name> typeParams, Expr value, SourcePosition position) implements Stmt {

    public TypeAlias {
        Objects.requireNonNull(name, "name");
        typeParams = List.copyOf(Objects.requireNonNull(typeParams, "typeParams"));
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(position, "position");
    }
}
