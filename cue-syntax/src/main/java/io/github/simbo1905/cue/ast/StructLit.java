package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A struct literal `{...}`. The declaration list is mutable so that decoders
/// can keep adding fields after the literal has been placed in a larger tree.
public final class StructLit implements Expr {

    private final List<Decl> elts;

    public StructLit() {
        this.elts = new ArrayList<>();
    }

    public StructLit(List<? extends Decl> elts) {
        this.elts = new ArrayList<>(elts);
    }

    public static StructLit of(Decl... elts) {
        return new StructLit(Arrays.asList(elts));
    }

    public List<Decl> elts() {
        return elts;
    }

    public StructLit add(Decl decl) {
        elts.add(decl);
        return this;
    }

    /// The fields of this struct in declaration order.
    public List<Field> fields() {
        final var out = new ArrayList<Field>();
        for (Decl d : elts) {
            if (d instanceof Field f) {
                out.add(f);
            }
        }
        return out;
    }

    public boolean isEmpty() {
        return elts.isEmpty();
    }

    @Override
    public String toString() {
        return Printer.format(this);
    }
}
