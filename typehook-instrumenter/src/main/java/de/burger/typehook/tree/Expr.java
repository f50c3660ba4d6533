package de.burger.typehook.tree;

/** Expression nodes. */
public sealed interface Expr extends Node
    permits Name, Constant, Attribute, Call, Subscript, Tuple, BinOp, Lambda {
}
