package de.burger.typehook.strategy;

import de.burger.typehook.tree.FunctionDef;

/** Decides whether a function declares any type hint the runtime facility could check. */
public interface TypedSignatureDetector {
    /** True if the function has a return annotation or at least one annotated parameter. */
    boolean isTyped(FunctionDef function);
}
