package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// `items` as an array of schemas - positional validation, with `additionalItems`
/// applied to every element past the end of the list
public record TupleItemsValidator(List<Validator> positional, Validator additionalItems) implements Validator {
  public TupleItemsValidator {
    positional = List.copyOf(positional);
    Objects.requireNonNull(additionalItems, "additionalItems");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isArray()) {
      return ValidationResult.success();
    }
    List<ValidationResult> results = new ArrayList<>(value.size());
    for (int i = 0; i < value.size(); i++) {
      Validator validator = i < positional.size() ? positional.get(i) : additionalItems;
      results.add(validator.validate(value.get(i)));
    }
    return ValidationResult.flatten(results);
  }
}
