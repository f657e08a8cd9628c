package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Label;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultMappingsTest extends JsonSchemaTestBase {

    @Test
    void definitionsBecomeCueDefinitions() {
        assertThat(names(DefaultMappings.map(List.of("$defs", "foo")))).containsExactly("#foo");
        assertThat(names(DefaultMappings.map(List.of("definitions", "Bar")))).containsExactly("#Bar");
    }

    @Test
    void awkwardNamesAreQuotedUnderHash() {
        final List<Label> labels = DefaultMappings.map(List.of("$defs", "a-b"));
        assertThat(labels).hasSize(2);
        assertThat(((Ident) labels.get(0)).name()).isEqualTo("#");
        assertThat(((BasicLit) labels.get(1)).value()).isEqualTo("a-b");
    }

    @Test
    void hiddenLookingNamesAreQuoted() {
        assertThat(DefaultMappings.map(List.of("$defs", "_x"))).hasSize(2);
        assertThat(DefaultMappings.map(List.of("$defs", "#x"))).hasSize(2);
    }

    @Test
    void otherPointersGoUnderInternalDefs() {
        final List<Label> labels = DefaultMappings.map(List.of("properties", "a/b"));
        assertThat(((Ident) labels.get(0)).name()).isEqualTo("_#defs");
        assertThat(((BasicLit) labels.get(1)).value()).isEqualTo("/properties/a~1b");
    }

    @Test
    void emptyPointerIsTheRoot() {
        assertThat(DefaultMappings.map(List.of())).isEmpty();
    }

    @Test
    void localLocationUsesItsPath() {
        final SchemaLoc loc = new SchemaLoc(URI.create(ExtractConfig.DEFAULT_ROOT_ID + "#/$defs/foo"), true,
                Path.of(Selector.str("$defs"), Selector.str("foo")));
        final CueLocation out = DefaultMappings.mapRef(loc);
        assertThat(out.isLocal()).isTrue();
        assertThat(out.path()).isEqualTo(Path.of(Selector.def("#foo")));
    }

    @Test
    void externalLocationImportsPackage() {
        final SchemaLoc loc = new SchemaLoc(URI.create("https://example.com/schemas/foo.json#/$defs/bar"), false,
                Path.EMPTY);
        final CueLocation out = DefaultMappings.mapRef(loc);
        assertThat(out.importPath()).isEqualTo("example.com/schemas/foo.json:foo");
        assertThat(out.path()).isEqualTo(Path.of(Selector.def("#bar")));
    }

    @Test
    void anchorsAreRejected() {
        final SchemaLoc loc = new SchemaLoc(URI.create("https://example.com/s.json#anchor"), false, Path.EMPTY);
        assertThatThrownBy(() -> DefaultMappings.mapRef(loc))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anchors (anchor) not supported");
    }

    @Test
    void urlPackageNames() {
        assertThat(DefaultMappings.mapURL(URI.create("https://example.com/schemas/v1")).importPath())
                .isEqualTo("example.com/schemas/v1");
        assertThat(DefaultMappings.mapURL(URI.create("https://example.com/a/my-schema.json")).importPath())
                .isEqualTo("example.com/a/my-schema.json:schema");
        assertThat(DefaultMappings.mapURL(URI.create("urn:foo")).importPath()).isEqualTo("Zm9v");
    }

    private static List<String> names(List<Label> labels) {
        return labels.stream().map(l -> ((Ident) l).name()).toList();
    }
}
