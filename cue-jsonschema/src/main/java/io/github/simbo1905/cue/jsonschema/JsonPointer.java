package io.github.simbo1905.cue.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.github.simbo1905.cue.jsonschema.SchemaLogging.LOG;

/// RFC 6901 JSON Pointer helpers.
public final class JsonPointer {

  private JsonPointer() {}

  /// Splits a pointer into its unescaped reference tokens.
  /// The empty pointer has no tokens; a leading `/` is optional.
  public static List<String> tokens(String pointer) {
    final List<String> out = new ArrayList<>();
    if (pointer.isEmpty()) {
      return out;
    }
    final String path = pointer.startsWith("/") ? pointer.substring(1) : pointer;
    for (String token : path.split("/", -1)) {
      out.add(unescape(token));
    }
    return out;
  }

  /// Joins tokens into a pointer, escaping `~` and `/`.
  public static String fromTokens(Iterable<String> tokens) {
    final StringBuilder sb = new StringBuilder();
    for (String token : tokens) {
      sb.append('/').append(escape(token));
    }
    return sb.toString();
  }

  static String escape(String token) {
    return token.replace("~", "~0").replace("/", "~1");
  }

  static String unescape(String token) {
    // Unescape ~1 -> / and ~0 -> ~
    return token.replace("~1", "/").replace("~0", "~");
  }

  /// Looks up the node a pointer addresses. Array indexes must be decimal without
  /// leading zeros.
  public static Optional<JsonNode> lookup(JsonNode root, String pointer) {
    LOG.finer(() -> "pointer.navigate pointer=" + pointer);
    JsonNode current = root;
    for (String token : tokens(pointer)) {
      if (current.isObject()) {
        current = current.get(token);
      } else if (current.isArray()) {
        final int index = arrayIndex(token);
        current = index < 0 ? null : current.get(index);
      } else {
        current = null;
      }
      if (current == null) {
        LOG.finer(() -> "pointer.missing pointer=" + pointer + " token=" + token);
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  private static int arrayIndex(String token) {
    if (token.isEmpty() || (token.length() > 1 && token.charAt(0) == '0')) {
      return -1;
    }
    for (int i = 0; i < token.length(); i++) {
      if (!Character.isDigit(token.charAt(i))) {
        return -1;
      }
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      return -1;
    }
  }
}
