package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/** {@code from module import names}; {@code level} counts leading dots of a relative import. */
public record ImportFrom(String module, List<Alias> names, int level, SourcePosition position) implements Stmt {

    public static final String FUTURE_MODULE = "__future__";

    public ImportFrom {
        Objects.requireNonNull(module, "module");
        names = List.copyOf(Objects.requireNonNull(names, "names"));
        Objects.requireNonNull(position, "position");
        if (level < 0) {
            throw new IllegalArgumentException("Negative import level: " + level);
        }
    }

    /** {@code from __future__ import ...}, which must precede every other import. */
    public boolean isFuture() {
        return level == 0 && FUTURE_MODULE.equals(module);
    }
}
