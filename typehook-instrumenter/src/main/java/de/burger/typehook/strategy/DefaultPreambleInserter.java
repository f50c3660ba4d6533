package de.burger.typehook.strategy;

import de.burger.typehook.config.RuntimeSymbols;
import de.burger.typehook.tree.Alias;
import de.burger.typehook.tree.Constant;
import de.burger.typehook.tree.ExprStmt;
import de.burger.typehook.tree.ImportFrom;
import de.burger.typehook.tree.SourceModule;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.Stmt;
import de.burger.typehook.util.NodeMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inserts {@code from <runtime module> import *}. A docstring must stay the first statement and
 * {@code from __future__} imports must precede every other statement, so the preamble goes right
 * after both. Modules consisting only of those (or nothing) are left alone.
 */
public final class DefaultPreambleInserter implements PreambleInserter {
    private static final String STAR = "*";

    private final RuntimeSymbols symbols;

    public DefaultPreambleInserter(RuntimeSymbols symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    @Override
    public SourceModule insertPreamble(SourceModule module) {
        List<Stmt> body = module.body();
        int index = insertionIndex(body);
        if (index == body.size()) {
            return module;
        }
        if (isPreamble(body.get(index))) {
            return module;
        }
        SourcePosition position = index == 0
            ? module.position()
            : NodeMetadata.insertionPosition(body, index, module);
        var newBody = new ArrayList<Stmt>(body.size() + 1);
        newBody.addAll(body.subList(0, index));
        newBody.add(new ImportFrom(symbols.runtimeModule(), List.of(Alias.of(STAR)), 0, position));
        newBody.addAll(body.subList(index, body.size()));
        return module.withBody(newBody);
    }

    @Override
    public int insertionIndex(List<Stmt> body) {
        int index = 0;
        if (!body.isEmpty() && isDocstring(body.get(0))) {
            index++;
        }
        // Stops at the first statement that is not a future import, so only the module head is scanned.
        while (index < body.size() && body.get(index) instanceof ImportFrom importFrom && importFrom.isFuture()) {
            index++;
        }
        return index;
    }

    @Override
    public boolean isPreamble(Stmt stmt) {
        return stmt instanceof ImportFrom importFrom
            && importFrom.level() == 0
            && importFrom.module().equals(symbols.runtimeModule())
            && importFrom.names().size() == 1
            && importFrom.names().get(0).name().equals(STAR);
    }

    private static boolean isDocstring(Stmt stmt) {
        return stmt instanceof ExprStmt exprStmt && exprStmt.value() instanceof Constant constant && constant.isString();
    }
}
