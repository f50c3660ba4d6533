package de.burger.typehook.scope;

/** Kind of lexical scope a node lives in. {@link #MODULE} is implicit and never pushed. */
public enum ScopeKind {
    MODULE,
    CLASS,
    FUNCTION
}
