package io.github.jsonschemalite.schema;

import java.util.List;
import java.util.Objects;

/// One entry of the `dependencies` keyword
public sealed interface Dependency permits Dependency.SchemaDependency, Dependency.PropertyDependency {

  /// `"trigger": { ...schema... }`
  record SchemaDependency(SchemaNode schema) implements Dependency {
    public SchemaDependency {
      Objects.requireNonNull(schema, "schema");
    }
  }

  /// `"trigger": ["a", "b"]`
  record PropertyDependency(List<String> properties) implements Dependency {
    public PropertyDependency {
      properties = List.copyOf(properties);
    }
  }
}
