package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

/// `minLength` / `maxLength` - length in code points; non-strings pass
public record StringLengthValidator(Bound bound, int length) implements Validator {

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isTextual()) {
      return ValidationResult.success();
    }
    String text = value.textValue();
    int actual = text.codePointCount(0, text.length());
    if (bound.admits(actual, length)) {
      return ValidationResult.success();
    }
    return ValidationResult.failure(bound == Bound.MAXIMUM
        ? "Length of string is larger than max length " + length
        : "Length of string is smaller than minimum length " + length);
  }
}
