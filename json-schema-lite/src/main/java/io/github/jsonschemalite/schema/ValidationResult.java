package io.github.jsonschemalite.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Outcome of applying a [Validator]: either [Valid] or [Invalid] with at least one message.
///
/// ```java
/// ValidationResult result = schema.validate(value);
/// if (!result.valid()) {
///   result.errors().forEach(System.out::println);
/// }
/// ```
public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

  /// @return true when the candidate value was accepted
  boolean valid();

  /// @return the violation messages in encounter order; empty when valid
  List<String> errors();

  static ValidationResult success() {
    return Valid.INSTANCE;
  }

  static ValidationResult failure(String message) {
    return new Invalid(List.of(message));
  }

  static ValidationResult failure(List<String> messages) {
    return new Invalid(messages);
  }

  /// Reduces results into one. Valid members contribute nothing; the messages of
  /// every invalid member are concatenated in order.
  static ValidationResult flatten(List<ValidationResult> results) {
    Objects.requireNonNull(results, "results");
    List<String> messages = new ArrayList<>();
    for (ValidationResult result : results) {
      messages.addAll(result.errors());
    }
    return messages.isEmpty() ? success() : new Invalid(messages);
  }

  /// Accepted value
  record Valid() implements ValidationResult {
    static final Valid INSTANCE = new Valid();

    @Override
    public boolean valid() {
      return true;
    }

    @Override
    public List<String> errors() {
      return List.of();
    }
  }

  /// Rejected value with its ordered, non-empty list of messages
  record Invalid(List<String> errors) implements ValidationResult {
    public Invalid {
      Objects.requireNonNull(errors, "errors");
      errors = List.copyOf(errors);
      if (errors.isEmpty()) {
        throw new IllegalArgumentException("Invalid result requires at least one message");
      }
    }

    @Override
    public boolean valid() {
      return false;
    }
  }
}
