package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

/// `minProperties` / `maxProperties` - non-objects pass
public record PropertyCountValidator(Bound bound, int count) implements Validator {

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isObject() || bound.admits(value.size(), count)) {
      return ValidationResult.success();
    }
    return ValidationResult.failure(bound == Bound.MAXIMUM
        ? "Amount of properties is greater than maximum permitted " + count
        : "Amount of properties is less than the required amount " + count);
  }
}
