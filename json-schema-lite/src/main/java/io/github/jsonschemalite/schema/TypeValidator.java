package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;
import java.util.stream.Collectors;

/// `type` keyword - the value's kind must be one of the listed types.
/// An empty set rejects every value.
public record TypeValidator(Set<PrimitiveType> types) implements Validator {
  public TypeValidator {
    types = Set.copyOf(types);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    for (PrimitiveType type : types) {
      if (type.matches(value)) {
        return ValidationResult.success();
      }
    }
    if (types.isEmpty()) {
      return ValidationResult.failure("No value can satisfy a 'type' that names no known type");
    }
    return ValidationResult.failure("Expected " + expected() + " but found " + PrimitiveType.describe(value));
  }

  private String expected() {
    if (types.size() == 1) {
      return "type '" + types.iterator().next().keyword() + "'";
    }
    // enum order keeps the message stable
    return types.stream()
        .sorted()
        .map(PrimitiveType::keyword)
        .collect(Collectors.joining("', '", "one of types '", "'"));
  }
}
