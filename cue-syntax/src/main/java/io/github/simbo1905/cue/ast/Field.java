package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A field declaration `label: value`, optionally marked `?` or `!`,
/// with trailing attributes and leading doc comment lines.
public final class Field implements Decl {

    /// The field constraint marker.
    public enum Constraint { REGULAR, OPTIONAL, REQUIRED }

    private final Label label;
    private Constraint constraint;
    private Expr value;
    private final List<Attribute> attrs = new ArrayList<>();
    private final List<String> doc = new ArrayList<>();

    public Field(Label label, Expr value) {
        this(label, Constraint.REGULAR, value);
    }

    public Field(Label label, Constraint constraint, Expr value) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.constraint = Objects.requireNonNull(constraint, "constraint must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /// A field whose label is an identifier when name allows it, otherwise a quoted string.
    public static Field named(String name, Expr value) {
        return new Field(stringLabel(name), value);
    }

    /// Label for a regular field called name: an identifier when that does not change
    /// the field's meaning, otherwise a string literal.
    public static Label stringLabel(String name) {
        if (Ident.isPlainLabel(name)) {
            return new Ident(name);
        }
        return BasicLit.string(name);
    }

    public Label label() {
        return label;
    }

    public Constraint constraint() {
        return constraint;
    }

    public Field constraint(Constraint c) {
        this.constraint = Objects.requireNonNull(c);
        return this;
    }

    public Expr value() {
        return value;
    }

    public Field value(Expr v) {
        this.value = Objects.requireNonNull(v);
        return this;
    }

    public List<Attribute> attrs() {
        return attrs;
    }

    public Field addAttr(Attribute attr) {
        attrs.add(attr);
        return this;
    }

    public List<String> doc() {
        return doc;
    }

    public Field addDoc(String text) {
        if (text != null && !text.isBlank()) {
            for (String line : text.strip().split("\\R")) {
                doc.add(line.stripTrailing());
            }
        }
        return this;
    }

    /// Returns the label as a plain name, or null for pattern labels.
    public String labelName() {
        if (label instanceof Ident id) {
            return id.name();
        }
        if (label instanceof BasicLit lit && lit.isString()) {
            return lit.value();
        }
        return null;
    }

    public boolean isPattern() {
        return label instanceof ListLit;
    }

    @Override
    public String toString() {
        return Printer.format(this);
    }
}
