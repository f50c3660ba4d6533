package de.burger.typehook.tree;

/**
 * Root of the closed syntax tree hierarchy handed to the instrumenter by an upstream parser.
 * Every node carries the source position it was parsed from.
 */
public sealed interface Node permits SourceModule, Stmt, Expr {
    SourcePosition position();
}
