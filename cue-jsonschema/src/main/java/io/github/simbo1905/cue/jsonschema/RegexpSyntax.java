package io.github.simbo1905.cue.jsonschema;

/// Checks that a regular expression stays within the RE2 dialect the output
/// language evaluates with. Java accepts more than RE2, so a pattern that
/// compiles here can still be unusable there.
final class RegexpSyntax {

  private static final String SPECIAL = "\\.+*?()|[]{}^$";

  private RegexpSyntax() {
  }

  /// Describes the first construct RE2 rejects, or returns null when there is none.
  static String unsupportedPerlSyntax(String re) {
    boolean inClass = false;
    for (int i = 0; i < re.length(); i++) {
      final char c = re.charAt(i);
      if (c == '\\') {
        if (i + 1 < re.length()) {
          final char next = re.charAt(i + 1);
          if (!inClass && next >= '1' && next <= '9') {
            return "invalid escape sequence: `\\" + next + "`";
          }
          if (!inClass && next == 'k' && i + 2 < re.length() && re.charAt(i + 2) == '<') {
            return "invalid escape sequence: `\\k`";
          }
        }
        i++;
        continue;
      }
      if (inClass) {
        if (c == ']') {
          inClass = false;
        }
        continue;
      }
      if (c == '[') {
        inClass = true;
        // A leading ] or ^] is literal.
        if (i + 1 < re.length() && re.charAt(i + 1) == '^') {
          i++;
        }
        if (i + 1 < re.length() && re.charAt(i + 1) == ']') {
          i++;
        }
        continue;
      }
      if (c == '(' && re.startsWith("(?", i)) {
        final String rest = re.substring(i + 2);
        if (rest.startsWith("=") || rest.startsWith("!") || rest.startsWith("<=") || rest.startsWith("<!")
            || rest.startsWith(">")) {
          final int end = rest.startsWith("<") ? 4 : 3;
          return "invalid or unsupported Perl syntax: `" + re.substring(i, Math.min(re.length(), i + end)) + "`";
        }
        continue;
      }
      if ((c == '*' || c == '+' || c == '?' || c == '}') && i + 1 < re.length() && re.charAt(i + 1) == '+') {
        return "invalid nested repetition operator: `" + c + "+`";
      }
    }
    return null;
  }

  /// Escapes every metacharacter so the result matches s literally.
  static String quoteMeta(String s) {
    final StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (SPECIAL.indexOf(c) >= 0) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
