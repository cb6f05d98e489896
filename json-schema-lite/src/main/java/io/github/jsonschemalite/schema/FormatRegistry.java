package io.github.jsonschemalite.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable mapping from `format` keyword values to their validators.
///
/// ```java
/// FormatRegistry formats = FormatRegistry.defaults()
///     .with("even-length", s -> s.length() % 2 == 0);
/// ```
public final class FormatRegistry {
  private static final FormatRegistry EMPTY = new FormatRegistry(Map.of());
  private static final FormatRegistry DEFAULTS = EMPTY
      .with(Format.IPV4.keyword(), Format.IPV4)
      .with(Format.IPV6.keyword(), Format.IPV6);

  private final Map<String, FormatValidator> formats;

  private FormatRegistry(Map<String, FormatValidator> formats) {
    this.formats = formats;
  }

  /// @return the built-in registry: `ipv4` and `ipv6`
  public static FormatRegistry defaults() {
    return DEFAULTS;
  }

  /// @return a registry where every `format` keyword fails as unsupported
  public static FormatRegistry empty() {
    return EMPTY;
  }

  /// Returns a copy with `name` bound to `validator`, replacing any previous binding
  public FormatRegistry with(String name, FormatValidator validator) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(validator, "validator");
    Map<String, FormatValidator> copy = new LinkedHashMap<>(formats);
    copy.put(name, validator);
    return new FormatRegistry(Map.copyOf(copy));
  }

  public Optional<FormatValidator> lookup(String name) {
    return Optional.ofNullable(formats.get(name));
  }

  public Set<String> names() {
    return formats.keySet();
  }

  @Override
  public String toString() {
    return "FormatRegistry" + names();
  }
}
