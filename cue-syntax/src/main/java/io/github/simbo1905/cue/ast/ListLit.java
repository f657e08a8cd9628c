package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A list literal `[a, b, ...T]`. Also used as a pattern label `[expr]`.
public final class ListLit implements Label {

    private final List<Expr> elts;

    public ListLit(List<? extends Expr> elts) {
        this.elts = new ArrayList<>(elts);
    }

    public static ListLit of(Expr... elts) {
        return new ListLit(Arrays.asList(elts));
    }

    public List<Expr> elts() {
        return elts;
    }

    /// The trailing ellipsis, if the list is open.
    public Ellipsis ellipsis() {
        if (!elts.isEmpty() && elts.get(elts.size() - 1) instanceof Ellipsis e) {
            return e;
        }
        return null;
    }

    @Override
    public String toString() {
        return Printer.format(this);
    }
}
