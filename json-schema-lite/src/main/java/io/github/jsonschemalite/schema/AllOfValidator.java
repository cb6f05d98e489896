package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/// AllOf composition - must satisfy all validators, every failure is reported
public record AllOfValidator(List<Validator> validators) implements Validator {
  public AllOfValidator {
    validators = List.copyOf(validators);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    List<ValidationResult> results = new ArrayList<>(validators.size());
    for (Validator validator : validators) {
      results.add(validator.validate(value));
    }
    return ValidationResult.flatten(results);
  }
}
