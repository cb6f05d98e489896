package io.github.jsonschemalite.schema;

/// Thrown when JSON text handed to a parsing entry point is not well-formed.
/// Validation failures are never reported this way; they are [ValidationResult.Invalid].
public final class JsonSchemaException extends RuntimeException {
  public JsonSchemaException(String message) {
    super(message);
  }

  public JsonSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
