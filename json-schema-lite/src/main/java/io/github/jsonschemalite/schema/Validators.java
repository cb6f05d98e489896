package io.github.jsonschemalite.schema;

import java.util.List;

/// Factory for the combinators that assemble sub-schema validators
public final class Validators {
  private Validators() {}

  /// Accepts every value
  public static Validator valid() {
    return AnyValidator.INSTANCE;
  }

  /// Rejects every value with the given message
  public static Validator invalid(String message) {
    return new FailValidator(message);
  }

  /// Accepts only when every validator accepts; reports all failures together.
  /// An empty list accepts everything.
  public static Validator allOf(List<Validator> validators) {
    return new AllOfValidator(validators);
  }

  public static Validator allOf(Validator... validators) {
    return new AllOfValidator(List.of(validators));
  }

  /// Accepts when at least one validator accepts
  public static Validator anyOf(List<Validator> validators) {
    return new AnyOfValidator(validators);
  }

  /// Accepts when exactly one validator accepts
  public static Validator oneOf(List<Validator> validators) {
    return new OneOfValidator(validators);
  }

  /// Accepts when the inner validator rejects
  public static Validator not(Validator validator) {
    return new NotValidator(validator);
  }
}
