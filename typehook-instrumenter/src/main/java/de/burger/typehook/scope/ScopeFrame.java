package de.burger.typehook.scope;

import java.util.Objects;

/** One open class or function scope and its dotted, module-prefixed name. */
public record ScopeFrame(ScopeKind kind, String qualifiedName) {

    public ScopeFrame {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
    }
}
