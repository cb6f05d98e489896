package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.jsonschemalite.schema.SchemaLogging.LOG;

/// Internal schema compiler.
///
/// One instance is one validation session: it turns [SchemaNode]s into validators and
/// owns the per-session `$ref` state (resolved targets and the references currently being
/// applied). Sessions are not shared between `validate` calls or threads.
public final class SchemaCompiler {
  private final JsonNode document;
  private final SchemaNode root;
  private final JsonSchemaOptions options;
  private final RefResolver resolver;

  /// Session state
  private final Map<String, Validator> resolvedRefs = new HashMap<>();
  private final Set<ActiveRef> activeRefs = new HashSet<>();

  SchemaCompiler(JsonNode document, SchemaNode root, JsonSchemaOptions options) {
    this.document = Objects.requireNonNull(document, "document");
    this.root = Objects.requireNonNull(root, "root");
    this.options = Objects.requireNonNull(options, "options");
    this.resolver = new RefResolver(document);
  }

  /// Compiles the root schema into a single validator
  Validator compileRoot() {
    return compileSchema(root);
  }

  /// Compiles a schema and reduces its keyword validators with `allOf`
  Validator compileSchema(SchemaNode schema) {
    List<Validator> validators = compile(schema);
    return validators.size() == 1 ? validators.get(0) : Validators.allOf(validators);
  }

  /// One validator per keyword present, in fixed keyword order
  List<Validator> compile(SchemaNode schema) {
    List<Validator> validators = new ArrayList<>();

    if (schema.ref() != null) {
      validators.add(new RefValidator(schema.ref(), this));
    }

    if (schema.types() != null) {
      validators.add(new TypeValidator(schema.types()));
    }

    if (schema.enumValues() != null) {
      validators.add(new EnumValidator(schema.enumValues()));
    }

    if (schema.maxLength() != null) {
      validators.add(new StringLengthValidator(Bound.MAXIMUM, schema.maxLength()));
    }
    if (schema.minLength() != null) {
      validators.add(new StringLengthValidator(Bound.MINIMUM, schema.minLength()));
    }

    if (schema.pattern() != null) {
      validators.add(compilePattern(schema.pattern()));
    }

    if (schema.multipleOf() != null) {
      if (schema.multipleOf().signum() > 0) {
        validators.add(new MultipleOfValidator(schema.multipleOf()));
      } else {
        validators.add(Validators.invalid("'multipleOf' must be greater than 0 but was " + JsonNodes.plain(schema.multipleOf())));
      }
    }

    if (schema.minimum() != null) {
      validators.add(new NumericBoundValidator(Bound.MINIMUM, schema.minimum(), schema.exclusiveMinimum()));
    }
    if (schema.maximum() != null) {
      validators.add(new NumericBoundValidator(Bound.MAXIMUM, schema.maximum(), schema.exclusiveMaximum()));
    }

    if (schema.minItems() != null) {
      validators.add(new ArrayLengthValidator(Bound.MINIMUM, schema.minItems()));
    }
    if (schema.maxItems() != null) {
      validators.add(new ArrayLengthValidator(Bound.MAXIMUM, schema.maxItems()));
    }

    if (schema.uniqueItems()) {
      validators.add(UniqueItemsValidator.INSTANCE);
    }

    if (schema.items() != null) {
      validators.add(new ItemsValidator(compileSchema(schema.items())));
    } else if (schema.tupleItems() != null) {
      List<Validator> positional = new ArrayList<>(schema.tupleItems().size());
      for (SchemaNode item : schema.tupleItems()) {
        positional.add(compileSchema(item));
      }
      Validator additional = compileAdditional(schema.additionalItems(),
          "Additional items are not permitted in this array.");
      validators.add(new TupleItemsValidator(positional, additional));
    }

    if (schema.maxProperties() != null) {
      validators.add(new PropertyCountValidator(Bound.MAXIMUM, schema.maxProperties()));
    }
    if (schema.minProperties() != null) {
      validators.add(new PropertyCountValidator(Bound.MINIMUM, schema.minProperties()));
    }

    if (schema.required() != null) {
      validators.add(new RequiredValidator(schema.required()));
    }

    if (schema.hasPropertyKeywords()) {
      validators.addAll(compileProperties(schema));
    }

    if (schema.dependencies() != null) {
      for (Map.Entry<String, Dependency> entry : schema.dependencies().entrySet()) {
        Dependency dependency = entry.getValue();
        if (dependency instanceof Dependency.SchemaDependency schemaDependency) {
          validators.add(new SchemaDependencyValidator(entry.getKey(), compileSchema(schemaDependency.schema())));
        } else if (dependency instanceof Dependency.PropertyDependency propertyDependency) {
          validators.add(new PropertyDependencyValidator(entry.getKey(), propertyDependency.properties()));
        }
      }
    }

    if (schema.format() != null) {
      String format = schema.format();
      validators.add(options.formats().lookup(format)
          .<Validator>map(validator -> new FormatCheckValidator(format, validator))
          .orElseGet(() -> {
            LOG.fine(() -> "compile: unsupported format '" + format + "'");
            return Validators.invalid("'format' validation of '" + format + "' is not supported.");
          }));
    }

    if (schema.allOf() != null) {
      validators.add(Validators.allOf(compileAll(schema.allOf())));
    }
    if (schema.anyOf() != null) {
      validators.add(Validators.anyOf(compileAll(schema.anyOf())));
    }
    if (schema.oneOf() != null) {
      validators.add(Validators.oneOf(compileAll(schema.oneOf())));
    }
    if (schema.not() != null) {
      validators.add(Validators.not(compileSchema(schema.not())));
    }

    LOG.finer(() -> "compile: " + validators.size() + " validators" + (schema.title() != null ? " for '" + schema.title() + "'" : ""));
    return validators;
  }

  private List<Validator> compileAll(List<SchemaNode> schemas) {
    List<Validator> compiled = new ArrayList<>(schemas.size());
    for (SchemaNode schema : schemas) {
      compiled.add(compileSchema(schema));
    }
    return compiled;
  }

  /// Properties validator plus one failing validator per pattern that does not compile
  private List<Validator> compileProperties(SchemaNode schema) {
    List<Validator> validators = new ArrayList<>();
    Map<String, Validator> properties = new LinkedHashMap<>();
    if (schema.properties() != null) {
      schema.properties().forEach((name, propertySchema) -> properties.put(name, compileSchema(propertySchema)));
    }
    Map<Pattern, Validator> patternProperties = new LinkedHashMap<>();
    if (schema.patternProperties() != null) {
      for (Map.Entry<String, SchemaNode> entry : schema.patternProperties().entrySet()) {
        try {
          patternProperties.put(Pattern.compile(entry.getKey()), compileSchema(entry.getValue()));
        } catch (PatternSyntaxException e) {
          LOG.fine(() -> "compile: invalid patternProperties regex '" + entry.getKey() + "': " + e.getDescription());
          validators.add(Validators.invalid("Invalid regular expression '" + entry.getKey() + "' in 'patternProperties'"));
        }
      }
    }
    Validator additional = compileAdditional(schema.additionalProperties(),
        "Additional properties are not permitted in this object.");
    validators.add(0, new PropertiesValidator(properties, patternProperties, additional));
    return validators;
  }

  /// `true` or absent accepts, `false` fails with `forbidden`, a schema is compiled
  private Validator compileAdditional(AdditionalSchema additional, String forbidden) {
    if (additional instanceof AdditionalSchema.Nested nested) {
      return compileSchema(nested.schema());
    }
    if (additional instanceof AdditionalSchema.Flag flag && !flag.allowed()) {
      return Validators.invalid(forbidden);
    }
    return Validators.valid();
  }

  private static Validator compilePattern(String regex) {
    try {
      return new PatternValidator(Pattern.compile(regex));
    } catch (PatternSyntaxException e) {
      LOG.fine(() -> "compile: invalid pattern regex '" + regex + "': " + e.getDescription());
      return Validators.invalid("Invalid regular expression '" + regex + "' in 'pattern'");
    }
  }

  /// Applies a `$ref`, resolving and compiling its target on first use in this session.
  ///
  /// A reference that is re-entered on the very same value while it is still being applied
  /// can never finish, so it fails instead of recursing.
  ValidationResult applyRef(String ref, JsonNode value) {
    ActiveRef key = new ActiveRef(ref, value);
    if (activeRefs.contains(key)) {
      LOG.warning(() -> "CYCLE: $ref " + ref + " re-entered without consuming input");
      return ValidationResult.failure("Circular $ref '" + ref + "' does not consume any input");
    }
    if (activeRefs.size() >= options.maxRefDepth()) {
      LOG.warning(() -> "DEPTH: $ref nesting reached " + options.maxRefDepth() + " at " + ref);
      return ValidationResult.failure("Maximum $ref depth of " + options.maxRefDepth() + " exceeded at '" + ref + "'");
    }
    Validator target = resolvedRefs.get(ref);
    if (target == null) {
      target = resolveRef(ref);
      resolvedRefs.put(ref, target);
    }
    activeRefs.add(key);
    try {
      return target.validate(value);
    } finally {
      activeRefs.remove(key);
    }
  }

  private Validator resolveRef(String ref) {
    LOG.fine(() -> "ref.apply resolving " + ref);
    RefResolver.Resolution resolution = resolver.resolve(ref);
    return resolution.targetIfFound()
        .map(target -> target == document ? compileSchema(root) : compileSchema(SchemaNode.decode(target)))
        .orElseGet(() -> Validators.invalid(resolution.failure()));
  }

  /// Reference applied to a value, compared by identity of the value node
  record ActiveRef(String ref, JsonNode value) {
    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof ActiveRef other)) {
        return false;
      }
      return ref.equals(other.ref) && value == other.value;
    }

    @Override
    public int hashCode() {
      return 31 * ref.hashCode() + System.identityHashCode(value);
    }
  }
}
