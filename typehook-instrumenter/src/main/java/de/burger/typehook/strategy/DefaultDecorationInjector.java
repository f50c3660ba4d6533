package de.burger.typehook.strategy;

import de.burger.typehook.config.ConfigRegistry;
import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.ClassDef;
import de.burger.typehook.tree.Expr;
import de.burger.typehook.tree.FunctionDef;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends {@code @<decorator>(conf=<configTable>[<id>])} to the decorator list. Appending makes
 * the hook the innermost decorator, so it sees the declaration before any user decorator wraps
 * it. The hook is built fresh for each declaration and carries that declaration's position.
 */
public final class DefaultDecorationInjector implements DecorationInjector {

    private final HookExpressions hooks;

    public DefaultDecorationInjector(RuntimeSymbols symbols, ConfigRegistry registry) {
        this.hooks = new HookExpressions(symbols, registry);
    }

    @Override
    public ClassDef decorate(ClassDef classDef, InstrumentationConfig config) {
        requireNamed(classDef.name(), classDef);
        if (isDecorated(classDef)) {
            return classDef;
        }
        return classDef.withDecorators(appended(classDef.decorators(), hook(classDef, config)));
    }

    @Override
    public FunctionDef decorate(FunctionDef function, InstrumentationConfig config) {
        requireNamed(function.name(), function);
        if (isDecorated(function)) {
            return function;
        }
        return function.withDecorators(appended(function.decorators(), hook(function, config)));
    }

    @Override
    public boolean isHook(Expr decorator) {
        return HookExpressions.isCallTo(decorator, hooks.symbols().decoratorName());
    }

    private Expr hook(Node target, InstrumentationConfig config) {
        Objects.requireNonNull(config, "config");
        return hooks.hookCall(hooks.symbols().decoratorName(), List.of(), config, target.position());
    }

    private static List<Expr> appended(List<Expr> decorators, Expr hook) {
        var out = new ArrayList<Expr>(decorators.size() + 1);
        out.addAll(decorators);
        out.add(hook);
        return out;
    }

    private static void requireNamed(String name, Node node) {
        if (name.isBlank()) {
            throw new MalformedNodeException("Declaration without a name", node);
        }
    }
}
