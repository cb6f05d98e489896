package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/// `enum` keyword - the value must structurally equal one of the allowed literals
public record EnumValidator(List<JsonNode> allowedValues) implements Validator {
  public EnumValidator {
    allowedValues = List.copyOf(allowedValues);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    for (JsonNode allowed : allowedValues) {
      if (JsonNodes.structurallyEqual(allowed, value)) {
        return ValidationResult.success();
      }
    }
    return ValidationResult.failure("Value " + value + " is not one of the allowed values " + allowedValues);
  }
}
