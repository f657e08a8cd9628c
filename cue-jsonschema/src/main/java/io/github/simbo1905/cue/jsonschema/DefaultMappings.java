package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.Path;
import io.github.simbo1905.cue.Selector;
import io.github.simbo1905.cue.ast.BasicLit;
import io.github.simbo1905.cue.ast.Ident;
import io.github.simbo1905.cue.ast.Label;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/// The default ways of naming schemas in the output.
///
/// Local fragments map as follows:
///
/// | fragment            | path                           |
/// |---------------------|--------------------------------|
/// | `#`                 | empty                          |
/// | `#/definitions/foo` | `#foo`, or `#."foo"` when foo is not an identifier |
/// | `#/$defs/foo`       | as for definitions             |
/// | anything else       | `_#defs."/json/pointer"`       |
public final class DefaultMappings {

  static final String ROOT_DEFS = "#";
  static final String INTERNAL_DEFS = "_#defs";

  private DefaultMappings() {
  }

  /// The default [ExtractConfig.MapRefFunc].
  public static CueLocation mapRef(SchemaLoc loc) {
    return mapRef(loc, DefaultMappings::map, DefaultMappings::mapURL);
  }

  /// Maps a location using a [ExtractConfig.MapFunc] for the fragment and a
  /// [ExtractConfig.MapURLFunc] for the rest of the URI.
  static CueLocation mapRef(SchemaLoc loc, ExtractConfig.MapFunc mapFn, ExtractConfig.MapURLFunc mapURLFn) {
    final String fragment;
    String importPath = "";
    Path base = Path.EMPTY;
    if (loc.isLocal()) {
      fragment = toJsonPointer(loc.path());
    } else {
      final String f = loc.id().getFragment();
      fragment = f == null ? "" : f;
      final CueLocation mapped = mapURLFn.map(withoutFragment(loc.id()));
      importPath = mapped.importPath();
      base = mapped.path();
    }
    if (!fragment.isEmpty() && fragment.charAt(0) != '/') {
      throw new IllegalArgumentException("anchors (" + fragment + ") not supported");
    }
    final List<Label> labels = mapFn.map(JsonPointer.tokens(fragment));
    Path out = base;
    for (Selector sel : toSelectors(labels)) {
      out = out.append(sel);
    }
    return new CueLocation(importPath, out);
  }

  /// The default [ExtractConfig.MapFunc].
  public static List<Label> map(List<String> tokens) {
    if (tokens.isEmpty()) {
      return List.of();
    }
    if (tokens.size() != 2 || !(tokens.get(0).equals("definitions") || tokens.get(0).equals("$defs"))) {
      return List.of(new Ident(INTERNAL_DEFS), BasicLit.string(JsonPointer.fromTokens(tokens)));
    }
    final String name = tokens.get(1);
    if (Ident.isValidIdent(name) && !name.equals(ROOT_DEFS.substring(1)) && !isDefOrHidden(name)) {
      return List.of(new Ident("#" + name));
    }
    return List.of(new Ident(ROOT_DEFS), BasicLit.string(name));
  }

  /// The default [ExtractConfig.MapURLFunc]. Host and path become the import path; a
  /// `.json` suffix is trimmed to find the package name, falling back to `schema`.
  public static CueLocation mapURL(URI u) {
    if (u.isOpaque()) {
      final String opaque = u.getRawSchemeSpecificPart();
      return new CueLocation(
          Base64.getUrlEncoder().withoutPadding().encodeToString(opaque.getBytes(StandardCharsets.UTF_8)),
          Path.EMPTY);
    }
    String p = u.getPath() == null ? "" : u.getPath();
    String base = baseName(p);
    if (!Ident.isValidIdent(base)) {
      if (base.endsWith(".json")) {
        base = base.substring(0, base.length() - ".json".length());
      }
      if (!Ident.isValidIdent(base)) {
        base = "schema";
      }
      p += ":" + base;
    }
    final String host = u.getHost() == null ? "" : u.getHost();
    return new CueLocation(host + p, Path.EMPTY);
  }

  static List<Selector> toSelectors(List<Label> labels) {
    final List<Selector> out = new ArrayList<>(labels.size());
    for (Label label : labels) {
      final Selector sel = Selector.fromLabel(label);
      if (sel == null) {
        throw new IllegalArgumentException("invalid label " + label);
      }
      out.add(sel);
    }
    return out;
  }

  /// The JSON Pointer for a path of regular and index selectors.
  static String toJsonPointer(Path p) {
    final StringBuilder sb = new StringBuilder();
    for (Selector sel : p.selectors()) {
      sb.append('/');
      switch (sel.type()) {
        case STRING -> sb.append(JsonPointer.escape(sel.unquoted()));
        case INDEX -> sb.append(sel.index());
        default -> throw new IllegalArgumentException("cannot convert selector " + sel + " to JSON pointer");
      }
    }
    return sb.toString();
  }

  static URI withoutFragment(URI u) {
    if (u.getRawFragment() == null) {
      return u;
    }
    final String s = u.toString();
    return URI.create(s.substring(0, s.indexOf('#')));
  }

  static URI withFragment(URI u, String fragment) {
    final URI base = withoutFragment(u);
    try {
      return new URI(base.getScheme(), base.getSchemeSpecificPart(), fragment);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("cannot add fragment to " + u, e);
    }
  }

  static boolean isDefOrHidden(String name) {
    return name.startsWith("#") || name.startsWith("_");
  }

  // Go's path.Base semantics: trailing slashes are dropped, an empty path is ".".
  private static String baseName(String p) {
    String s = p;
    while (s.length() > 1 && s.endsWith("/")) {
      s = s.substring(0, s.length() - 1);
    }
    if (s.isEmpty()) {
      return ".";
    }
    if (s.equals("/")) {
      return "/";
    }
    return s.substring(s.lastIndexOf('/') + 1);
  }
}
