package io.github.jsonschemalite.schema;

/// Format validator interface for string format validation
@FunctionalInterface
public interface FormatValidator {
  /// Test if the string value matches the format
  /// @param s the string to test
  /// @return true if the string matches the format, false otherwise
  boolean test(String s);
}
