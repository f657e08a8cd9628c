package io.github.simbo1905.cue.ast;

/// An expression: anything that can appear as a field value, list element or operand.
public sealed interface Expr extends Node
        permits Label, StructLit, Ellipsis, UnaryExpr, BinaryExpr, CallExpr, SelectorExpr, IndexExpr, BottomLit {}
