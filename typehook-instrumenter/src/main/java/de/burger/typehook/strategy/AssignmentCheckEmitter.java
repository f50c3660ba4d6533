package de.burger.typehook.strategy;

import de.burger.typehook.config.InstrumentationConfig;
import de.burger.typehook.tree.AnnAssign;
import de.burger.typehook.tree.Stmt;
import java.util.Optional;

/** Emits the statement that validates the value bound by an annotated assignment. */
public interface AssignmentCheckEmitter {
    /** Check to place right after {@code assignment}; empty when the assignment cannot be checked. */
    Optional<Stmt> checkFor(AnnAssign assignment, InstrumentationConfig config);

    /** True if {@code candidate} is the check this emitter produces for {@code assignment}. */
    boolean isCheckFor(AnnAssign assignment, Stmt candidate);
}
