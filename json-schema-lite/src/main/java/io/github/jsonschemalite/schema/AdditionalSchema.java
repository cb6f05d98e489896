package io.github.jsonschemalite.schema;

import java.util.Objects;

/// Value of `additionalItems` / `additionalProperties`: a boolean flag or a nested schema
public sealed interface AdditionalSchema permits AdditionalSchema.Flag, AdditionalSchema.Nested {

  record Flag(boolean allowed) implements AdditionalSchema {
  }

  record Nested(SchemaNode schema) implements AdditionalSchema {
    public Nested {
      Objects.requireNonNull(schema, "schema");
    }
  }
}
