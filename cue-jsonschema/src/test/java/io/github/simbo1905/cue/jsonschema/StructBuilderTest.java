package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.ast.EmbedDecl;
import io.github.simbo1905.cue.ast.Expr;
import io.github.simbo1905.cue.ast.Field;
import io.github.simbo1905.cue.ast.File;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Printer;
import io.github.simbo1905.cue.ast.SelectorExpr;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructBuilderTest extends JsonSchemaTestBase {

    private static final Path FOO = Path.of(Selector.def("#Foo"));

    @Test
    void putRejectsSecondValueAtSamePath() {
        final StructBuilder b = new StructBuilder();
        assertThat(b.put(FOO, new Ident("int"), null)).isTrue();
        assertThat(b.put(FOO, new Ident("string"), null)).isFalse();
    }

    @Test
    void entriesSortRegularFieldsBeforeDefinitions() {
        final StructBuilder b = new StructBuilder();
        b.put(FOO, new Ident("int"), null);
        b.put(Path.of(Selector.str("z")), new Ident("string"), null);
        b.put(Path.of(Selector.str("a")), new Ident("bool"), null);
        assertThat(Printer.format(b.syntax())).isEqualTo("a: bool\nz: string\n#Foo: int\n");
    }

    @Test
    void nestedPathsShareParent() {
        final StructBuilder b = new StructBuilder();
        b.put(Path.of(Selector.def("#A"), Selector.str("x")), new Ident("int"), null);
        b.put(Path.of(Selector.def("#A"), Selector.str("y")), new Ident("string"), null);
        final File f = b.syntax();
        assertThat(f.decls()).hasSize(2);
        assertThat(f.decls()).allSatisfy(d -> assertThat(((Field) d).labelName()).isEqualTo("#A"));
    }

    @Test
    void referencesBindOnceSyntaxIsBuilt() {
        final StructBuilder b = new StructBuilder();
        final Expr ref = b.getRef(FOO);
        assertThat(ref).isInstanceOf(Ident.class);
        assertThat(((Ident) ref).node()).isNull();

        final Ident value = new Ident("int");
        b.put(FOO, value, null);
        b.syntax();
        assertThat(((Ident) ref).node()).isSameAs(value);
    }

    @Test
    void referenceIntoDefinitionSelects() {
        final StructBuilder b = new StructBuilder();
        final Expr ref = b.getRef(Path.of(Selector.def("#A"), Selector.str("x")));
        assertThat(ref).isInstanceOf(SelectorExpr.class);
    }

    @Test
    void referenceMustStartWithIdentifier() {
        final StructBuilder b = new StructBuilder();
        assertThatThrownBy(() -> b.getRef(Path.of(Selector.str("not an ident"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be expressed as an identifier");
    }

    @Test
    void rootReferenceWrapsFile() {
        final StructBuilder b = new StructBuilder();
        final Expr ref = b.getRef(Path.EMPTY);
        final Ident value = new Ident("string");
        b.put(Path.EMPTY, value, null);
        final File f = b.syntax();

        assertThat(f.decls()).hasSize(2);
        assertThat(f.decls().get(0)).isInstanceOf(EmbedDecl.class);
        assertThat(((Field) f.decls().get(1)).labelName()).isEqualTo(StructBuilder.ROOT_IDENT_NAME);
        assertThat(((Ident) ref).node()).isSameAs(value);
    }

    @Test
    void valueWithEntriesEmbedsValue() {
        final StructBuilder b = new StructBuilder();
        b.put(Path.EMPTY, new Ident("int"), null);
        b.put(FOO, new Ident("string"), null);
        assertThat(Printer.format(b.syntax())).isEqualTo("int\n#Foo: string\n");
    }

    @Test
    void commentsBecomeDocs() {
        final StructBuilder b = new StructBuilder();
        b.put(Path.EMPTY, new Ident("int"), "the root");
        b.put(FOO, new Ident("string"), "a foo\nover two lines");
        final File f = b.syntax();
        assertThat(f.doc()).containsExactly("the root");
        assertThat(((Field) f.decls().get(1)).doc()).containsExactly("a foo", "over two lines");
    }
}
