package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

import static io.github.jsonschemalite.schema.SchemaLogging.LOG;

/// AnyOf composition - must satisfy at least one validator
public record AnyOfValidator(List<Validator> validators) implements Validator {
  static final String NO_MATCH = "Value does not match any schema in 'anyOf'";

  public AnyOfValidator {
    validators = List.copyOf(validators);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    List<String> collected = new ArrayList<>();
    for (int i = 0; i < validators.size(); i++) {
      ValidationResult branch = validators.get(i).validate(value);
      if (branch.valid()) {
        final int matched = i;
        LOG.finest(() -> "anyOf: branch " + matched + " matched");
        return ValidationResult.success();
      }
      collected.addAll(branch.errors());
    }
    // an empty anyOf has no branch messages to report
    return collected.isEmpty() ? ValidationResult.failure(NO_MATCH) : ValidationResult.failure(collected);
  }
}
