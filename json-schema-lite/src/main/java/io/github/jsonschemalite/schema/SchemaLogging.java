package io.github.jsonschemalite.schema;

import java.util.logging.Logger;

/// Centralized logger for the validator.
/// All classes must use this logger via:
///   import static io.github.jsonschemalite.schema.SchemaLogging.LOG;
final class SchemaLogging {
  static final Logger LOG = Logger.getLogger("io.github.jsonschemalite.schema");
  private SchemaLogging() {}
}
