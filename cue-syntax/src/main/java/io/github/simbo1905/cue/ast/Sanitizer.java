package io.github.simbo1905.cue.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Adds the import declarations a file needs. Every identifier created with
/// [Ident#imported(String)] contributes its path; the resulting imports are sorted
/// and placed directly after the package clause.
public final class Sanitizer {

    private static final Logger LOG = Logger.getLogger(Sanitizer.class.getName());

    private Sanitizer() {}

    public static File sanitize(File file) {
        final TreeSet<String> paths = new TreeSet<>();
        Ast.walk(file, n -> {
            if (n instanceof Ident id && id.importPath() != null) {
                paths.add(id.importPath());
            } else if (n instanceof ImportDecl i) {
                paths.add(i.path());
            }
        });
        final List<Decl> decls = file.decls();
        decls.removeIf(d -> d instanceof ImportDecl);
        int at = 0;
        for (int i = 0; i < decls.size(); i++) {
            if (decls.get(i) instanceof Package) {
                at = i + 1;
                break;
            }
        }
        final List<Decl> imports = new ArrayList<>();
        paths.forEach(p -> imports.add(new ImportDecl(p)));
        decls.addAll(at, imports);
        LOG.finer(() -> "Sanitized imports: " + paths);
        return file;
    }
}
