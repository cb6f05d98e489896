/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.jsonschemalite.schema.SchemaLogging.LOG;

/// JSON Schema public API entry point
///
/// Holds a schema document together with its metadata and the options used to
/// validate against it. Instances are immutable and may be shared; every call to
/// [#validate(JsonNode)] compiles the document afresh in its own session.
///
/// ## Usage
/// ```java
/// JsonSchema schema = JsonSchema.parse("""
///     {"type":"integer","minimum":0}
///     """);
///
/// ValidationResult result = schema.validate(mapper.readTree("-1"));
///
/// if (!result.valid()) {
///   for (String error : result.errors()) {
///     System.out.println(error);
///   }
/// }
/// ```
public final class JsonSchema {
  private final JsonNode document;
  private final SchemaNode root;
  private final JsonSchemaOptions options;

  /// @param document the schema document
  public JsonSchema(JsonNode document) {
    this(document, JsonSchemaOptions.DEFAULT);
  }

  /// @param document the schema document
  /// @param options formats and limits used while validating
  public JsonSchema(JsonNode document, JsonSchemaOptions options) {
    this.document = Objects.requireNonNull(document, "document").deepCopy();
    this.options = Objects.requireNonNull(options, "options");
    this.root = SchemaNode.decode(this.document);
    LOG.fine(() -> "JsonSchema created title=" + root.title() + ", options: " + options.summary());
  }

  /// Parses schema text with default options
  ///
  /// @throws JsonSchemaException if the text is not well-formed JSON
  public static JsonSchema parse(String schemaJson) {
    return parse(schemaJson, JsonSchemaOptions.DEFAULT);
  }

  /// Parses schema text
  ///
  /// @throws JsonSchemaException if the text is not well-formed JSON
  public static JsonSchema parse(String schemaJson, JsonSchemaOptions options) {
    return new JsonSchema(JsonNodes.parse(schemaJson), options);
  }

  /// One-shot validation with default options
  ///
  /// @param value the candidate value
  /// @param schemaDocument the schema document
  /// @return the validation outcome
  public static ValidationResult validate(JsonNode value, JsonNode schemaDocument) {
    return new JsonSchema(schemaDocument).validate(value);
  }

  /// Validates a value against this schema
  ///
  /// @param value JSON value to validate
  /// @return ValidationResult with success/failure information
  public ValidationResult validate(JsonNode value) {
    Objects.requireNonNull(value, "value");
    LOG.fine(() -> "json-schema.validate start type=" + value.getNodeType());
    SchemaCompiler session = new SchemaCompiler(document, root, options);
    ValidationResult result = session.compileRoot().validate(value);
    LOG.fine(() -> "json-schema.validate done valid=" + result.valid() + " errors=" + result.errors().size());
    return result;
  }

  /// Parses and validates JSON text
  ///
  /// @throws JsonSchemaException if the text is not well-formed JSON
  public ValidationResult validate(String json) {
    return validate(JsonNodes.parse(json));
  }

  public Optional<String> title() {
    return Optional.ofNullable(root.title());
  }

  public Optional<String> description() {
    return Optional.ofNullable(root.description());
  }

  /// @return the types named by the root `type` keyword; empty when absent or when none is known
  public Set<PrimitiveType> types() {
    return root.types() == null ? Set.of() : root.types();
  }

  /// @return a copy of the schema document
  public JsonNode document() {
    return document.deepCopy();
  }

  public JsonSchemaOptions options() {
    return options;
  }

  @Override
  public String toString() {
    return "JsonSchema[" + title().orElse("untitled") + "]";
  }
}
