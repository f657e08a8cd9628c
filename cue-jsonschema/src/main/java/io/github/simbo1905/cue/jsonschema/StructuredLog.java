package io.github.simbo1905.cue.jsonschema;

import io.github.simbo1905.cue.ast.Printer;

import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// One-line `event=NAME key=value` records for the translator's JUL tracing.
/// Values are flattened to a single line and cut at a fixed width; values holding
/// spaces, quotes or `=` are written as quoted strings.
final class StructuredLog {

  private static final int MAX_VALUE = 200;
  private static final Map<String, AtomicLong> SEEN = new ConcurrentHashMap<>();

  private StructuredLog() {
  }

  static void fine(Logger log, String event, Object... kv) {
    at(log, Level.FINE, event, kv);
  }

  static void finer(Logger log, String event, Object... kv) {
    at(log, Level.FINER, event, kv);
  }

  /// FINEST for every nth occurrence of an event. Keyword dispatch logs once per
  /// keyword per phase, which floods a trace of a large document.
  static void finestSampled(Logger log, String event, int everyN, Object... kv) {
    if (!log.isLoggable(Level.FINEST)) {
      return;
    }
    final long n = SEEN.computeIfAbsent(event, k -> new AtomicLong()).incrementAndGet();
    if (everyN <= 1 || n % everyN == 0) {
      log.finest(() -> line(event, kv) + " seen=" + n);
    }
  }

  private static void at(Logger log, Level level, String event, Object[] kv) {
    if (log.isLoggable(level)) {
      log.log(level, () -> line(event, kv));
    }
  }

  /// A trailing key without a value is dropped.
  static String line(String event, Object... kv) {
    final StringJoiner out = new StringJoiner(" ");
    out.add("event=" + flatten(event));
    for (int i = 0; i + 1 < kv.length; i += 2) {
      if (kv[i] != null) {
        out.add(kv[i] + "=" + render(kv[i + 1]));
      }
    }
    return out.toString();
  }

  private static String render(Object value) {
    final String s = flatten(String.valueOf(value));
    final boolean quote = s.isEmpty()
        || s.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"' || c == '=');
    return quote ? Printer.quote(s) : s;
  }

  private static String flatten(String s) {
    final String cut = s.length() > MAX_VALUE ? s.substring(0, MAX_VALUE) + "..." : s;
    return cut.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
  }
}
