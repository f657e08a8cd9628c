package io.github.simbo1905.cue.ast;

import io.github.simbo1905.cue.CueTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrinterTest extends CueTestBase {

    @Test
    void printsFileSections() {
        final File f = new File();
        f.add(new Package("foo"));
        f.add(new ImportDecl("strings"));
        f.add(Attribute.of("jsonschema", "schema=\"x\""));
        f.add(Field.named("name",
                CallExpr.of(SelectorExpr.of(Ident.imported("strings"), "MinRunes"), BasicLit.integer(1)))
                .constraint(Field.Constraint.OPTIONAL));

        assertThat(Printer.format(f)).isEqualTo("""
                package foo

                import "strings"

                @jsonschema(schema="x")

                name?: strings.MinRunes(1)
                """);
    }

    @Test
    void groupsMultipleImports() {
        final File f = new File();
        f.add(new ImportDecl("list"));
        f.add(new ImportDecl("strings"));
        f.add(new EmbedDecl(Ident.top()));

        assertThat(Printer.format(f)).isEqualTo("import (\n\t\"list\"\n\t\"strings\"\n)\n\n_\n");
    }

    @Test
    void indentsNestedStructsWithTabs() {
        final Field a = Field.named("a", StructLit.of(
                new Field(new Ident("b"), Field.Constraint.OPTIONAL, new Ident("int")),
                Field.named("c-d", ListLit.of(new Ident("string"), new Ellipsis()))));

        assertThat(Printer.format(a)).isEqualTo("a: {\n\tb?: int\n\t\"c-d\": [string, ...]\n}");
    }

    @Test
    void emptyStructIsCompact() {
        assertThat(Printer.format(new StructLit())).isEqualTo("{}");
    }

    @Test
    void parenthesizesByPrecedence() {
        final Ident a = new Ident("a");
        final Ident b = new Ident("b");
        final Ident c = new Ident("c");
        assertThat(Printer.format(new BinaryExpr(Op.AND, new BinaryExpr(Op.OR, a, b), c))).isEqualTo("(a | b) & c");
        assertThat(Printer.format(new BinaryExpr(Op.OR, new BinaryExpr(Op.AND, a, b), c))).isEqualTo("a & b | c");
        assertThat(Printer.format(new UnaryExpr(Op.GEQ, BasicLit.number("-1")))).isEqualTo(">=-1");
    }

    @Test
    void quotesLabelsThatAreNotPlainIdentifiers() {
        assertThat(Printer.format(Field.named("string", Ident.top()))).isEqualTo("\"string\": _");
        assertThat(Printer.format(Field.named("_x", Ident.top()))).isEqualTo("\"_x\": _");
        assertThat(Printer.format(Field.named("#x", Ident.top()))).isEqualTo("\"#x\": _");
        assertThat(Printer.format(Field.named("ok", Ident.top()))).isEqualTo("ok: _");
    }

    @Test
    void escapesStrings() {
        assertThat(Printer.quote("a\"b\n\\")).isEqualTo("\"a\\\"b\\n\\\\\"");
        assertThat(Printer.quote("\u0001")).isEqualTo("\"\\u0001\"");
    }

    @Test
    void printsDocCommentsAndAttributes() {
        final Field f = Field.named("x", new Ident("int"))
                .addDoc("First line.\nSecond line.")
                .addAttr(Attribute.of("deprecated", ""));
        assertThat(Printer.format(StructLit.of(f)))
                .isEqualTo("{\n\t// First line.\n\t// Second line.\n\tx: int @deprecated()\n}");
    }
}
