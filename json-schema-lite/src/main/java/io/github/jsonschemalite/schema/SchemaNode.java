package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.github.jsonschemalite.schema.SchemaLogging.LOG;

/// Typed view of one schema object, produced by a single decoding pass.
///
/// A field is null when its keyword is absent or holds a value of the wrong JSON kind.
/// Sub-schemas are decoded eagerly; `$ref` targets are not, they stay as the raw string.
public record SchemaNode(
    String title,
    String description,
    String ref,
    Set<PrimitiveType> types,
    List<JsonNode> enumValues,
    Integer maxLength,
    Integer minLength,
    String pattern,
    BigDecimal multipleOf,
    BigDecimal minimum,
    BigDecimal maximum,
    boolean exclusiveMinimum,
    boolean exclusiveMaximum,
    Integer minItems,
    Integer maxItems,
    boolean uniqueItems,
    SchemaNode items,
    List<SchemaNode> tupleItems,
    AdditionalSchema additionalItems,
    Integer maxProperties,
    Integer minProperties,
    List<String> required,
    Map<String, SchemaNode> properties,
    Map<String, SchemaNode> patternProperties,
    AdditionalSchema additionalProperties,
    Map<String, Dependency> dependencies,
    String format,
    List<SchemaNode> allOf,
    List<SchemaNode> anyOf,
    List<SchemaNode> oneOf,
    SchemaNode not
) {

  /// The schema with no keywords, which accepts everything
  public static final SchemaNode EMPTY = new SchemaNode(null, null, null, null, null, null, null, null, null,
      null, null, false, false, null, null, false, null, null, null, null, null, null, null, null, null, null,
      null, null, null, null, null);

  /// Decodes a schema document. Anything other than a JSON object decodes to [#EMPTY].
  public static SchemaNode decode(JsonNode schema) {
    Objects.requireNonNull(schema, "schema");
    if (!schema.isObject()) {
      LOG.finest(() -> "decode: non-object schema treated as empty: " + schema.getNodeType());
      return EMPTY;
    }
    JsonNode items = schema.get("items");
    return new SchemaNode(
        text(schema, "title"),
        text(schema, "description"),
        text(schema, "$ref"),
        types(schema.get("type")),
        literals(schema.get("enum")),
        JsonNodes.intKeyword(schema, "maxLength"),
        JsonNodes.intKeyword(schema, "minLength"),
        text(schema, "pattern"),
        JsonNodes.decimalKeyword(schema, "multipleOf"),
        JsonNodes.decimalKeyword(schema, "minimum"),
        JsonNodes.decimalKeyword(schema, "maximum"),
        flag(schema, "exclusiveMinimum"),
        flag(schema, "exclusiveMaximum"),
        JsonNodes.intKeyword(schema, "minItems"),
        JsonNodes.intKeyword(schema, "maxItems"),
        flag(schema, "uniqueItems"),
        items != null && items.isObject() ? decode(items) : null,
        items != null && items.isArray() ? schemas(items) : null,
        additional(schema.get("additionalItems")),
        JsonNodes.intKeyword(schema, "maxProperties"),
        JsonNodes.intKeyword(schema, "minProperties"),
        strings(schema.get("required")),
        schemaMap(schema.get("properties")),
        schemaMap(schema.get("patternProperties")),
        additional(schema.get("additionalProperties")),
        dependencies(schema.get("dependencies")),
        text(schema, "format"),
        schemas(schema.get("allOf")),
        schemas(schema.get("anyOf")),
        schemas(schema.get("oneOf")),
        objectSchema(schema.get("not"))
    );
  }

  /// @return true when any of `properties`, `patternProperties` or `additionalProperties` is present
  public boolean hasPropertyKeywords() {
    return properties != null || patternProperties != null || additionalProperties != null;
  }

  private static String text(JsonNode schema, String keyword) {
    JsonNode node = schema.get(keyword);
    return node != null && node.isTextual() ? node.textValue() : null;
  }

  private static boolean flag(JsonNode schema, String keyword) {
    JsonNode node = schema.get(keyword);
    return node != null && node.isBoolean() && node.booleanValue();
  }

  /// Unknown type names are dropped; a `type` naming only unknown types decodes to an empty set
  private static Set<PrimitiveType> types(JsonNode node) {
    if (node == null) {
      return null;
    }
    List<String> names = new ArrayList<>();
    if (node.isTextual()) {
      names.add(node.textValue());
    } else if (node.isArray()) {
      for (JsonNode element : node) {
        if (element.isTextual()) {
          names.add(element.textValue());
        }
      }
    } else {
      return null;
    }
    Set<PrimitiveType> types = EnumSet.noneOf(PrimitiveType.class);
    for (String name : names) {
      PrimitiveType.fromKeyword(name).ifPresentOrElse(types::add,
          () -> LOG.fine(() -> "decode: ignoring unknown type '" + name + "'"));
    }
    return Collections.unmodifiableSet(types);
  }

  private static List<JsonNode> literals(JsonNode node) {
    if (node == null || !node.isArray()) {
      return null;
    }
    List<JsonNode> values = new ArrayList<>(node.size());
    node.forEach(values::add);
    return List.copyOf(values);
  }

  private static List<String> strings(JsonNode node) {
    if (node == null || !node.isArray()) {
      return null;
    }
    List<String> values = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      if (element.isTextual()) {
        values.add(element.textValue());
      }
    }
    return List.copyOf(values);
  }

  private static SchemaNode objectSchema(JsonNode node) {
    return node != null && node.isObject() ? decode(node) : null;
  }

  private static List<SchemaNode> schemas(JsonNode node) {
    if (node == null || !node.isArray()) {
      return null;
    }
    List<SchemaNode> schemas = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      schemas.add(decode(element));
    }
    return List.copyOf(schemas);
  }

  private static Map<String, SchemaNode> schemaMap(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    Map<String, SchemaNode> schemas = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      schemas.put(entry.getKey(), decode(entry.getValue()));
    }
    return Collections.unmodifiableMap(schemas);
  }

  private static AdditionalSchema additional(JsonNode node) {
    if (node == null) {
      return null;
    }
    if (node.isBoolean()) {
      return new AdditionalSchema.Flag(node.booleanValue());
    }
    return node.isObject() ? new AdditionalSchema.Nested(decode(node)) : null;
  }

  private static Map<String, Dependency> dependencies(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    Map<String, Dependency> dependencies = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode value = entry.getValue();
      if (value.isObject()) {
        dependencies.put(entry.getKey(), new Dependency.SchemaDependency(decode(value)));
      } else if (value.isArray()) {
        dependencies.put(entry.getKey(), new Dependency.PropertyDependency(strings(value)));
      }
    }
    return Collections.unmodifiableMap(dependencies);
  }
}
