package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/// `dependencies` schema form - when the trigger property is present the whole object must satisfy the schema
public record SchemaDependencyValidator(String property, Validator dependency) implements Validator {
  public SchemaDependencyValidator {
    Objects.requireNonNull(property, "property");
    Objects.requireNonNull(dependency, "dependency");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (value.isObject() && value.has(property)) {
      return dependency.validate(value);
    }
    return ValidationResult.success();
  }
}
