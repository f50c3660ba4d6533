package de.burger.typehook.strategy;

import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.tree.Stmt;
import de.burger.typehook.tree.TypeAlias;

/**
 * Emits the statement that hands a {@code type} alias to the runtime facility, which resolves
 * the alias's forward references once the names it mentions exist.
 */
public interface TypeAliasHookEmitter {
    /** Statement to place right after {@code alias}. */
    Stmt hookFor(TypeAlias alias, InstrumentationConfig config);

    /** True if {@code candidate} is the hook this emitter produces for {@code alias}. */
    boolean isHookFor(TypeAlias alias, Stmt candidate);
}
