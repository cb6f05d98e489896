package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// `items` as a single schema - applied to every element
public record ItemsValidator(Validator items) implements Validator {
  public ItemsValidator {
    Objects.requireNonNull(items, "items");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isArray()) {
      return ValidationResult.success();
    }
    List<ValidationResult> results = new ArrayList<>(value.size());
    for (JsonNode element : value) {
      results.add(items.validate(element));
    }
    return ValidationResult.flatten(results);
  }
}
