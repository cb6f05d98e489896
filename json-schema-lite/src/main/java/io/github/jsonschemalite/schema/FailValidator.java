package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/// Rejects all values with a fixed message. Used for unsupported features and broken references.
public record FailValidator(String message) implements Validator {
  public FailValidator {
    Objects.requireNonNull(message, "message");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    return ValidationResult.failure(message);
  }
}
