package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/// The seven JSON Schema primitive type names
public enum PrimitiveType {
  OBJECT,
  ARRAY,
  STRING,
  INTEGER,
  NUMBER,
  BOOLEAN,
  NULL;

  /// @return the name used by the `type` keyword
  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }

  /// Looks up a `type` keyword value. Matching is exact: `"String"` is not a type.
  public static Optional<PrimitiveType> fromKeyword(String keyword) {
    for (PrimitiveType type : values()) {
      if (type.keyword().equals(keyword)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /// Tests the runtime kind of a value. `integer` also accepts floating
  /// numbers without a fractional part; `number` accepts every number.
  public boolean matches(JsonNode value) {
    return switch (this) {
      case OBJECT -> value.isObject();
      case ARRAY -> value.isArray();
      case STRING -> value.isTextual();
      case INTEGER -> JsonNodes.isIntegral(value);
      case NUMBER -> value.isNumber();
      case BOOLEAN -> value.isBoolean();
      case NULL -> value.isNull();
    };
  }

  /// Most specific type of a value, for messages
  static String describe(JsonNode value) {
    if (JsonNodes.isIntegral(value)) {
      return INTEGER.keyword();
    }
    for (PrimitiveType type : values()) {
      if (type.matches(value)) {
        return type.keyword();
      }
    }
    return value.getNodeType().name().toLowerCase(Locale.ROOT);
  }
}
