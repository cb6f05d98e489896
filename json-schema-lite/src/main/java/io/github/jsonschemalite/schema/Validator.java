package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

/// A compiled keyword check. Pure: the same value always yields the same result,
/// and the value is never mutated.
@FunctionalInterface
public interface Validator {
  ValidationResult validate(JsonNode value);
}
