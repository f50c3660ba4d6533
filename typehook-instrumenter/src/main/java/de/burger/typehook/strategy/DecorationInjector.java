package de.burger.typehook.strategy;

import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.tree.ClassDef;
import de.burger.typehook.tree.Expr;
import de.burger.typehook.tree.FunctionDef;

/**
 * Attaches the runtime hook to a declaration as its innermost decorator. Implementations return
 * a copy and leave declarations that already carry the hook untouched.
 */
public interface DecorationInjector {
    ClassDef decorate(ClassDef classDef, InstrumentationConfig config);

    FunctionDef decorate(FunctionDef function, InstrumentationConfig config);

    /** True if {@code decorator} is the hook this injector emits. */
    boolean isHook(Expr decorator);

    default boolean isDecorated(ClassDef classDef) {
        return classDef.decorators().stream().anyMatch(this::isHook);
    }

    default boolean isDecorated(FunctionDef function) {
        return function.decorators().stream().anyMatch(this::isHook);
    }
}
