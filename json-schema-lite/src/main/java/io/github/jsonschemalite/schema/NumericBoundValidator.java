package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Objects;

/// `minimum` / `maximum` with the boolean `exclusiveMinimum` / `exclusiveMaximum` modifiers
public record NumericBoundValidator(Bound bound, BigDecimal limit, boolean exclusive) implements Validator {
  public NumericBoundValidator {
    Objects.requireNonNull(bound, "bound");
    Objects.requireNonNull(limit, "limit");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isNumber()) {
      return ValidationResult.success();
    }
    int comparison = JsonNodes.compareNumber(value, limit);
    if (bound.admits(comparison, exclusive)) {
      return ValidationResult.success();
    }
    String shown = JsonNodes.plain(limit);
    if (bound == Bound.MINIMUM) {
      return ValidationResult.failure(exclusive
          ? "Value must be greater than exclusive minimum value of " + shown
          : "Value is lower than minimum value of " + shown);
    }
    return ValidationResult.failure(exclusive
        ? "Value must be less than exclusive maximum value of " + shown
        : "Value exceeds maximum value of " + shown);
  }
}
