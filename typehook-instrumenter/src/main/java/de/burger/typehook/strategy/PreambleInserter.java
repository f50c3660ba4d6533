package de.burger.typehook.strategy;

import de.burger.typehook.tree.SourceModule;
import de.burger.typehook.tree.Stmt;
import java.util.List;

/** Places the import that makes the runtime hook names visible inside a rewritten module. */
public interface PreambleInserter {
    /** The module with the preamble inserted, or the same module when none is needed. */
    SourceModule insertPreamble(SourceModule module);

    /** First index the preamble may occupy: after the docstring and any future imports. */
    int insertionIndex(List<Stmt> body);

    boolean isPreamble(Stmt stmt);
}
