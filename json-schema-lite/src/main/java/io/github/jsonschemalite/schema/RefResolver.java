package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import static io.github.jsonschemalite.schema.SchemaLogging.LOG;

/// Resolves local `$ref` strings against the root document.
///
/// Supported forms are `#` (the whole document) and `#/a/b/0` (a JSON Pointer into it,
/// percent-decoded, with `~1` and `~0` unescaped). Everything else is treated as a
/// remote reference, which is not supported.
final class RefResolver {
  static final String SCHEMA_POINTER_ROOT = "#";
  static final String SCHEMA_POINTER_PREFIX = "#/";

  private final JsonNode document;

  RefResolver(JsonNode document) {
    this.document = Objects.requireNonNull(document, "document");
  }

  /// Outcome of navigating a reference: the target schema document, or the message to fail with
  record Resolution(JsonNode target, String failure) {
    static Resolution found(JsonNode target) {
      return new Resolution(target, null);
    }

    static Resolution failed(String failure) {
      return new Resolution(null, failure);
    }

    Optional<JsonNode> targetIfFound() {
      return Optional.ofNullable(target);
    }
  }

  Resolution resolve(String ref) {
    if (SCHEMA_POINTER_ROOT.equals(ref)) {
      return Resolution.found(document);
    }
    if (!ref.startsWith(SCHEMA_POINTER_PREFIX)) {
      return unsupported(ref);
    }
    final String pointer;
    try {
      // URLDecoder would turn '+' into a space
      pointer = URLDecoder.decode(ref.substring(SCHEMA_POINTER_PREFIX.length()).replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      LOG.fine(() -> "ref.resolve malformed escape in " + ref + ": " + e.getMessage());
      return unsupported(ref);
    }

    JsonNode current = document;
    for (String token : pointer.split("/", -1)) {
      String segment = token.replace("~1", "/").replace("~0", "~");
      JsonNode next = step(current, segment);
      if (next == null) {
        LOG.fine(() -> "ref.resolve missing segment '" + segment + "' in " + ref);
        return Resolution.failed("Reference not found '" + segment + "' in '" + ref + "'");
      }
      current = next;
    }
    LOG.finer(() -> "ref.resolve resolved " + ref);
    return Resolution.found(current);
  }

  private static JsonNode step(JsonNode current, String segment) {
    if (current.isObject()) {
      return current.get(segment);
    }
    if (current.isArray() && segment.matches("0|[1-9][0-9]{0,9}")) {
      long index = Long.parseLong(segment);
      return index < current.size() ? current.get((int) index) : null;
    }
    return null;
  }

  private static Resolution unsupported(String ref) {
    return Resolution.failed("Remote $ref '" + ref + "' is not supported");
  }
}
