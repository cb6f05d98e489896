package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;

/// Accessor helpers over Jackson trees
final class JsonNodes {
  private JsonNodes() {}

  /// Shared mapper; floats are read as BigDecimal so `multipleOf` and the bounds see exact literals
  static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  /// Exponents beyond this are rendered in scientific notation
  private static final int PLAIN_DIGITS = 32;

  /// Leaf comparator for structural equality: numbers compare by value so `1` equals `1.0`
  private static final Comparator<JsonNode> LEAF_EQUALITY = (a, b) -> {
    if (a.isNumber() && b.isNumber() && isFinite(a) && isFinite(b)) {
      return a.decimalValue().compareTo(b.decimalValue());
    }
    return a.equals(b) ? 0 : 1;
  };

  /// JSON structural equality, recursing through arrays and objects
  static boolean structurallyEqual(JsonNode a, JsonNode b) {
    return a.equals(LEAF_EQUALITY, b);
  }

  /// A number node whose value has a decimal form. Trees read by a plain `ObjectMapper`
  /// hold overflowing literals such as `1e400` as an infinite `DoubleNode`.
  static boolean isFinite(JsonNode value) {
    if (value.isDouble() || value.isFloat()) {
      return Double.isFinite(value.doubleValue());
    }
    return value.isNumber();
  }

  /// Sign of `value - limit`; non-finite values compare as doubles
  static int compareNumber(JsonNode value, BigDecimal limit) {
    if (isFinite(value)) {
      return value.decimalValue().compareTo(limit);
    }
    return Double.compare(value.doubleValue(), limit.doubleValue());
  }

  /// Exact `value / divisor` is an integer, for a positive divisor.
  ///
  /// With both sides reduced to `unscaled * 10^-scale`, the quotient is
  /// `a * 10^shift / b`, so only `10^shift mod b` is ever computed.
  static boolean isMultipleOf(BigDecimal value, BigDecimal divisor) {
    if (value.signum() == 0) {
      return true;
    }
    BigDecimal v = value.stripTrailingZeros();
    BigDecimal d = divisor.stripTrailingZeros();
    BigInteger a = v.unscaledValue().abs();
    BigInteger b = d.unscaledValue();
    long shift = (long) d.scale() - v.scale();
    if (shift < 0) {
      // a has no factor of 10 left, so it cannot absorb 10^-shift
      return false;
    }
    BigInteger power = BigInteger.TEN.modPow(BigInteger.valueOf(shift), b);
    return a.mod(b).multiply(power).mod(b).signum() == 0;
  }

  /// @return true for integral numbers and for floating numbers without a fractional part
  static boolean isIntegral(JsonNode value) {
    if (value.isIntegralNumber()) {
      return true;
    }
    if (!value.isNumber()) {
      return false;
    }
    if (!isFinite(value)) {
      return false;
    }
    BigDecimal decimal = value.decimalValue();
    return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
  }

  /// Reads an int keyword such as `maxLength`; null when absent, not integral, or out of int range
  static Integer intKeyword(JsonNode schema, String keyword) {
    JsonNode node = schema.get(keyword);
    if (node == null || !isIntegral(node)) {
      return null;
    }
    BigDecimal value = node.decimalValue();
    if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0
        || value.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) < 0) {
      return null;
    }
    return value.intValue();
  }

  /// Reads a numeric keyword; null when absent, not a number, or not finite
  static BigDecimal decimalKeyword(JsonNode schema, String keyword) {
    JsonNode node = schema.get(keyword);
    return node != null && isFinite(node) ? node.decimalValue() : null;
  }

  /// Plain rendering of a schema number for messages: `0`, `2.5`, `1000`
  static String plain(BigDecimal value) {
    if (value.signum() == 0) {
      return "0";
    }
    BigDecimal stripped = value.stripTrailingZeros();
    // 1e2000000 would otherwise print two million digits
    if (stripped.scale() < -PLAIN_DIGITS || stripped.scale() > PLAIN_DIGITS) {
      return stripped.toString();
    }
    return stripped.toPlainString();
  }

  /// Parses JSON text into a tree
  ///
  /// @throws JsonSchemaException if the text is not well-formed JSON
  static JsonNode parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      JsonNode node = MAPPER.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new JsonSchemaException("No JSON content to parse");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new JsonSchemaException("Malformed JSON: " + e.getOriginalMessage(), e);
    }
  }
}
