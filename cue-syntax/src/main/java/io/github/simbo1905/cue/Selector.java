package io.github.simbo1905.cue;

import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Label;
import io.github.simbo1905.cue.ast.Printer;

import java.util.Comparator;
import java.util.Objects;

/// One step in a [Path]: a regular field name, a definition, a hidden field or a list index.
public record Selector(Type type, String name, int index) implements Comparable<Selector> {

    /// Selector categories, in the order selectors sort.
    public enum Type { STRING, DEFINITION, HIDDEN, INDEX }

    private static final Comparator<Selector> ORDER =
            Comparator.comparing(Selector::type).thenComparing(Selector::toString);

    public Selector {
        Objects.requireNonNull(type, "type must not be null");
        if (type != Type.INDEX) {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    public static Selector str(String name) {
        return new Selector(Type.STRING, name, -1);
    }

    /// A definition selector; the name includes its leading `#`.
    public static Selector def(String name) {
        if (!name.startsWith("#")) {
            throw new IllegalArgumentException("definition name must start with '#': " + name);
        }
        return new Selector(Type.DEFINITION, name, -1);
    }

    public static Selector hid(String name) {
        return new Selector(Type.HIDDEN, name, -1);
    }

    public static Selector index(int i) {
        return new Selector(Type.INDEX, null, i);
    }

    /// The selector a field label introduces, or null for pattern labels.
    public static Selector fromLabel(Label label) {
        if (label instanceof Ident id) {
            if (id.isDefinition()) {
                return id.name().startsWith("_#") ? hid(id.name()) : def(id.name());
            }
            return id.isHidden() ? hid(id.name()) : str(id.name());
        }
        if (label instanceof BasicLit lit && lit.isString()) {
            return str(lit.value());
        }
        return null;
    }

    /// The label that declares a field for this selector.
    public Label label() {
        return switch (type) {
            case STRING -> Ident.isPlainLabel(name) ? new Ident(name) : BasicLit.string(name);
            case DEFINITION, HIDDEN -> new Ident(name);
            case INDEX -> BasicLit.integer(index);
        };
    }

    public boolean isDefinition() {
        return type == Type.DEFINITION;
    }

    public boolean isRegular() {
        return type == Type.STRING;
    }

    /// The name without quoting, or the index as text.
    public String unquoted() {
        return type == Type.INDEX ? Integer.toString(index) : name;
    }

    @Override
    public int compareTo(Selector other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        if (type == Type.INDEX) {
            return Integer.toString(index);
        }
        if (type == Type.STRING && !Ident.isPlainLabel(name)) {
            return Printer.quote(name);
        }
        return name;
    }
}
