package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

/// `uniqueItems: true` - no two elements may be structurally equal
public record UniqueItemsValidator() implements Validator {
  static final UniqueItemsValidator INSTANCE = new UniqueItemsValidator();

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isArray()) {
      return ValidationResult.success();
    }
    for (int i = 0; i < value.size(); i++) {
      for (int j = i + 1; j < value.size(); j++) {
        if (JsonNodes.structurallyEqual(value.get(i), value.get(j))) {
          return ValidationResult.failure("Array items must be unique: item " + j + " repeats item " + i);
        }
      }
    }
    return ValidationResult.success();
  }
}
