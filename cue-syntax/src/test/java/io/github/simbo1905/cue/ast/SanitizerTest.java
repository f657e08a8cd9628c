package io.github.simbo1905.cue.ast;

import io.github.simbo1905.cue.CueTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SanitizerTest extends CueTestBase {

    @Test
    void addsSortedImportsAfterPackageClause() {
        final File f = new File();
        f.add(new Package("x"));
        f.add(Field.named("a", CallExpr.of(SelectorExpr.of(Ident.imported("strings"), "MinRunes"), BasicLit.integer(1))));
        f.add(Field.named("b", CallExpr.of(SelectorExpr.of(Ident.imported("list"), "MinItems"), BasicLit.integer(1))));
        f.add(Field.named("c", CallExpr.of(SelectorExpr.of(Ident.imported("strings"), "MaxRunes"), BasicLit.integer(2))));

        Sanitizer.sanitize(f);

        assertThat(f.decls().subList(0, 3)).containsExactly(
                new Package("x"), new ImportDecl("list"), new ImportDecl("strings"));
        assertThat(f.decls()).hasSize(6);
    }

    @Test
    void usesQualifierForImportedIdentifierName() {
        assertThat(Ident.imported("example.com/foo/bar:baz").name()).isEqualTo("baz");
        assertThat(Ident.imported("example.com/foo/bar@v0").name()).isEqualTo("bar");
        assertThat(Ident.imported("strings").name()).isEqualTo("strings");
    }
}
