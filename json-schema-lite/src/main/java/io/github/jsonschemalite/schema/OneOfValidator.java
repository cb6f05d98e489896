package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

import static io.github.jsonschemalite.schema.SchemaLogging.LOG;

/// OneOf composition - must satisfy exactly one validator
public record OneOfValidator(List<Validator> validators) implements Validator {
  static final String NO_MATCH = "Value does not match any schema in 'oneOf'";

  public OneOfValidator {
    validators = List.copyOf(validators);
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    int validCount = 0;
    List<String> branchErrors = new ArrayList<>();

    for (Validator validator : validators) {
      ValidationResult branch = validator.validate(value);
      if (branch.valid()) {
        validCount++;
      } else {
        branchErrors.addAll(branch.errors());
      }
    }

    final int matched = validCount;
    LOG.finest(() -> "oneOf: " + matched + " of " + validators.size() + " branches matched");

    if (validCount == 1) {
      return ValidationResult.success();
    }
    if (validCount == 0) {
      List<String> messages = new ArrayList<>(branchErrors.size() + 1);
      messages.add(NO_MATCH);
      messages.addAll(branchErrors);
      return ValidationResult.failure(messages);
    }
    return ValidationResult.failure("Value matches more than one schema in 'oneOf' (" + validCount + " matched)");
  }
}
