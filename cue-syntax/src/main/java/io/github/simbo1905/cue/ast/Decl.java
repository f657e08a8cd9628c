package io.github.simbo1905.cue.ast;

/// A declaration inside a struct literal or at the top level of a file.
public sealed interface Decl extends Node
        permits Field, EmbedDecl, Ellipsis, Attribute, Package, ImportDecl {}
