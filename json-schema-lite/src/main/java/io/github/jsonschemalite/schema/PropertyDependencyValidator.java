package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// `dependencies` array form - when the trigger property is present each named property must be too
public record PropertyDependencyValidator(String property, List<String> dependencies) implements Validator {
  public PropertyDependencyValidator {
    Objects.requireNonNull(property, "property");
    dependencies = List.copyOf(dependencies);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isObject() || !value.has(property)) {
      return ValidationResult.success();
    }
    List<String> missing = new ArrayList<>();
    for (String dependency : dependencies) {
      if (!value.has(dependency)) {
        missing.add("'" + property + "' is missing its dependency of '" + dependency + "'");
      }
    }
    return missing.isEmpty() ? ValidationResult.success() : ValidationResult.failure(missing);
  }
}
