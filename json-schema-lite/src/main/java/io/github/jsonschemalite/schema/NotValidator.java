package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/// Not composition - inverts the inner result; the inner messages are dropped
public record NotValidator(Validator validator) implements Validator {
  static final String MATCHED = "Value must not match the schema in 'not'";

  public NotValidator {
    Objects.requireNonNull(validator, "validator");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    return validator.validate(value).valid()
        ? ValidationResult.failure(MATCHED)
        : ValidationResult.success();
  }
}
