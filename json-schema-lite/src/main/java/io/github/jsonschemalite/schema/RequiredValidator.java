package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/// `required` keyword - one message per missing property
public record RequiredValidator(List<String> required) implements Validator {
  public RequiredValidator {
    required = List.copyOf(required);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isObject()) {
      return ValidationResult.success();
    }
    List<String> missing = new ArrayList<>();
    for (String name : required) {
      if (!value.has(name)) {
        missing.add("Required property '" + name + "' is missing");
      }
    }
    return missing.isEmpty() ? ValidationResult.success() : ValidationResult.failure(missing);
  }
}
