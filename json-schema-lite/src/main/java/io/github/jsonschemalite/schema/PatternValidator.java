package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.regex.Pattern;

/// `pattern` keyword - unanchored match using `find()`; non-strings pass
public record PatternValidator(Pattern pattern) implements Validator {
  public PatternValidator {
    Objects.requireNonNull(pattern, "pattern");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isTextual() || pattern.matcher(value.textValue()).find()) {
      return ValidationResult.success();
    }
    return ValidationResult.failure("String '" + value.textValue() + "' does not match pattern '" + pattern.pattern() + "'");
  }
}
