package io.github.jsonschemalite.schema;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationResultTest extends JsonSchemaTestBase {

    @Test
    void successCarriesNoMessages() {
        var result = ValidationResult.success();
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result).isInstanceOf(ValidationResult.Valid.class);
    }

    @Test
    void invalidRequiresAtLeastOneMessage() {
        assertThatThrownBy(() -> ValidationResult.failure(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ValidationResult.Invalid(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidCopiesItsMessages() {
        var messages = new ArrayList<String>();
        messages.add("first");
        var result = ValidationResult.failure(messages);
        messages.add("second");

        assertThat(result.errors()).containsExactly("first");
        assertThatThrownBy(() -> result.errors().add("third"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void flattenOfValidResultsIsValid() {
        var result = ValidationResult.flatten(List.of(ValidationResult.success(), ValidationResult.success()));
        assertThat(result.valid()).isTrue();
    }

    @Test
    void flattenOfNothingIsValid() {
        assertThat(ValidationResult.flatten(List.of()).valid()).isTrue();
    }

    @Test
    void flattenConcatenatesMessagesInOrder() {
        var result = ValidationResult.flatten(List.of(
            ValidationResult.failure(List.of("a", "b")),
            ValidationResult.success(),
            ValidationResult.failure("c")
        ));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("a", "b", "c");
    }

    @Test
    void flattenIsAssociative() {
        var a = ValidationResult.failure("a");
        var b = ValidationResult.failure("b");
        var c = ValidationResult.failure("c");

        var left = ValidationResult.flatten(List.of(ValidationResult.flatten(List.of(a, b)), c));
        var right = ValidationResult.flatten(List.of(a, ValidationResult.flatten(List.of(b, c))));

        assertThat(left).isEqualTo(right);
    }
}
