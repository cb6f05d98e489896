package io.github.jsonschemalite.schema;

import java.util.Objects;

/// Options for validation
///
/// @param formats validators available to the `format` keyword
/// @param maxRefDepth how many `$ref` applications may be nested before validation gives up
public record JsonSchemaOptions(FormatRegistry formats, int maxRefDepth) {
  /// Built-in formats and a nesting limit of 512
  public static final JsonSchemaOptions DEFAULT = new JsonSchemaOptions(FormatRegistry.defaults(), 512);

  public JsonSchemaOptions {
    Objects.requireNonNull(formats, "formats");
    if (maxRefDepth < 1) {
      throw new IllegalArgumentException("maxRefDepth must be at least 1: " + maxRefDepth);
    }
  }

  public JsonSchemaOptions withFormats(FormatRegistry formats) {
    return new JsonSchemaOptions(formats, maxRefDepth);
  }

  public JsonSchemaOptions withFormat(String name, FormatValidator validator) {
    return new JsonSchemaOptions(formats.with(name, validator), maxRefDepth);
  }

  public JsonSchemaOptions withMaxRefDepth(int maxRefDepth) {
    return new JsonSchemaOptions(formats, maxRefDepth);
  }

  String summary() {
    return "formats=" + formats.names() + ", maxRefDepth=" + maxRefDepth;
  }
}
