package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/// `format` keyword backed by a registered [FormatValidator]; non-strings pass
public record FormatCheckValidator(String name, FormatValidator format) implements Validator {
  public FormatCheckValidator {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(format, "format");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isTextual() || format.test(value.textValue())) {
      return ValidationResult.success();
    }
    return ValidationResult.failure("'" + value.textValue() + "' is not a valid '" + name + "'");
  }
}
