package de.burger.typehook.config;

/** How thoroughly the runtime facility checks containers. Opaque to the instrumenter. */
public enum CheckStrategy {
    /** No checking; hooks stay in place but do nothing. */
    O0,
    /** Constant time: one randomly chosen item per container. */
    O1,
    /** Linear time: every item. */
    ON
}
