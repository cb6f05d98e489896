package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/// Reference validator for `$ref`; the target is resolved when first applied
public record RefValidator(String ref, SchemaCompiler compiler) implements Validator {
  public RefValidator {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(compiler, "compiler");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    return compiler.applyRef(ref, value);
  }

  @Override
  public String toString() {
    return "RefValidator[" + ref + "]";
  }
}
