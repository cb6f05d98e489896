package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/// `properties`, `patternProperties` and `additionalProperties` working together.
///
/// Each member is checked against its declared schema and against every pattern
/// that finds a match in its name. Members matched by neither go to `additionalProperties`.
public record PropertiesValidator(
    Map<String, Validator> properties,
    Map<Pattern, Validator> patternProperties,
    Validator additionalProperties
) implements Validator {
  public PropertiesValidator {
    properties = Map.copyOf(properties);
    // keep declaration order so messages come out in schema order
    patternProperties = Collections.unmodifiableMap(new LinkedHashMap<>(patternProperties));
    Objects.requireNonNull(additionalProperties, "additionalProperties");
  }

  @Override
  public ValidationResult validate(JsonNode value) {
    if (!value.isObject()) {
      return ValidationResult.success();
    }
    List<ValidationResult> results = new ArrayList<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> member = it.next();
      String name = member.getKey();
      JsonNode memberValue = member.getValue();
      boolean matched = false;

      Validator declared = properties.get(name);
      if (declared != null) {
        results.add(declared.validate(memberValue));
        matched = true;
      }
      for (Map.Entry<Pattern, Validator> pattern : patternProperties.entrySet()) {
        if (pattern.getKey().matcher(name).find()) {
          results.add(pattern.getValue().validate(memberValue));
          matched = true;
        }
      }
      if (!matched) {
        results.add(additionalProperties.validate(memberValue));
      }
    }
    return ValidationResult.flatten(results);
  }
}
