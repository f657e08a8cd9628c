package io.github.simbo1905.cue.ast;

import java.util.Objects;

/// A selection `x.sel` where sel is an identifier or a quoted string label.
public record SelectorExpr(Expr x, Label sel) implements Expr {

    public SelectorExpr {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(sel, "sel must not be null");
        if (sel instanceof ListLit) {
            throw new IllegalArgumentException("pattern label cannot be used as a selector");
        }
    }

    public static SelectorExpr of(Expr x, String name) {
        return new SelectorExpr(x, new Ident(name));
    }
}
