package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

/// `minItems` / `maxItems` - non-arrays pass
public record ArrayLengthValidator(Bound bound, int length) implements Validator {

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isArray() || bound.admits(value.size(), length)) {
      return ValidationResult.success();
    }
    return ValidationResult.failure(bound == Bound.MAXIMUM
        ? "Length of array is greater than maximum " + length
        : "Length of array is smaller than the minimum " + length);
  }
}
