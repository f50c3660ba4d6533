package de.burger.typehook.tree;

/** Statement nodes. The permitted set is closed so traversals can dispatch over every kind. */
public sealed interface Stmt extends Node
    permits ClassDef, FunctionDef, Import, ImportFrom, ExprStmt, Assign, AnnAssign,
        Return, Pass, If, For, While, With, Try, TypeAlias {
}
