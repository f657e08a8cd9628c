package io.github.simbo1905.cue.ast;

/// Root of the syntax tree: every expression, declaration and file is a node.
public sealed interface Node permits Expr, Decl, File {}
