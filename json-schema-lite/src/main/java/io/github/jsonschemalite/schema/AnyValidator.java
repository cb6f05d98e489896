package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

/// Any validator - accepts all values
public record AnyValidator() implements Validator {
  static final AnyValidator INSTANCE = new AnyValidator();

  @Override
  public ValidationResult validate(JsonNode value) {
    return ValidationResult.success();
  }
}
