package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.List;

/// A source file: a package clause, imports and the top-level declarations.
public final class File implements Node {

    private final List<Decl> decls;
    private final List<String> doc = new ArrayList<>();

    public File() {
        this.decls = new ArrayList<>();
    }

    public File(List<? extends Decl> decls) {
        this.decls = new ArrayList<>(decls);
    }

    public List<Decl> decls() {
        return decls;
    }

    public File add(Decl d) {
        decls.add(d);
        return this;
    }

    public List<String> doc() {
        return doc;
    }

    /// The package name, or null if there is no package clause.
    public String packageName() {
        for (Decl d : decls) {
            if (d instanceof Package p) {
                return p.name();
            }
        }
        return null;
    }

    public List<ImportDecl> imports() {
        final var out = new ArrayList<ImportDecl>();
        for (Decl d : decls) {
            if (d instanceof ImportDecl i) {
                out.add(i);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return Printer.format(this);
    }
}
