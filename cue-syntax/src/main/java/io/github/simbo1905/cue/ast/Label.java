package io.github.simbo1905.cue.ast;

/// A field label. Identifiers and string literals name a single field,
/// a single-element list literal is a pattern constraint such as `[=~"^x"]`.
public sealed interface Label extends Expr permits Ident, BasicLit, ListLit {}
