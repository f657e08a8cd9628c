package io.github.simbo1905.cue.jsonschema;

import java.util.logging.Logger;

/// The one logger shared by extraction and generation. FINE marks entry points and
/// passes, FINER reference resolution, FINEST single keywords.
final class SchemaLogging {
  static final Logger LOG = Logger.getLogger("io.github.simbo1905.cue.jsonschema");

  private SchemaLogging() {
  }
}
