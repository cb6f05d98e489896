package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/// `multipleOf` keyword - exact decimal division; non-numbers pass
public record MultipleOfValidator(BigDecimal divisor) implements Validator {
  public MultipleOfValidator {
    if (divisor.signum() <= 0) {
      throw new IllegalArgumentException("multipleOf must be greater than 0: " + divisor);
    }
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isNumber()) {
      return ValidationResult.success();
    }
    if (!JsonNodes.isFinite(value)) {
      return ValidationResult.failure("Value " + value.asText() + " is not a multiple of " + JsonNodes.plain(divisor));
    }
    if (JsonNodes.isMultipleOf(value.decimalValue(), divisor)) {
      return ValidationResult.success();
    }
    return ValidationResult.failure("Value " + JsonNodes.plain(value.decimalValue())
        + " is not a multiple of " + JsonNodes.plain(divisor));
  }
}
