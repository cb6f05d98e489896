package io.github.jsonschemalite.schema;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Combinator behaviour independent of any schema document
class ValidatorsTest extends JsonSchemaTestBase {

    private static final JsonNode VALUE = json("42");

    private static Validator failing(String message) {
        return Validators.invalid(message);
    }

    @Test
    void validAcceptsEverything() {
        assertThat(Validators.valid().validate(VALUE).valid()).isTrue();
        assertThat(Validators.valid().validate(json("null")).valid()).isTrue();
    }

    @Test
    void invalidAlwaysFailsWithItsMessage() {
        var result = Validators.invalid("nope").validate(VALUE);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("nope");
    }

    @Test
    void allOfReportsEveryFailureWithoutShortCircuit() {
        var result = Validators.allOf(failing("one"), Validators.valid(), failing("two")).validate(VALUE);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("one", "two");
    }

    @Test
    void emptyAllOfAccepts() {
        assertThat(Validators.allOf(List.of()).validate(VALUE).valid()).isTrue();
    }

    @Test
    void anyOfAcceptsWhenOneBranchAccepts() {
        var result = Validators.anyOf(List.of(failing("one"), Validators.valid())).validate(VALUE);
        assertThat(result.valid()).isTrue();
    }

    @Test
    void anyOfAggregatesAllBranchMessagesWhenNoneMatch() {
        var result = Validators.anyOf(List.of(failing("one"), failing("two"))).validate(VALUE);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("one", "two");
    }

    @Test
    void emptyAnyOfFailsWithAMessage() {
        var result = Validators.anyOf(List.of()).validate(VALUE);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(AnyOfValidator.NO_MATCH);
    }

    @Test
    void oneOfAcceptsExactlyOneMatch() {
        var result = Validators.oneOf(List.of(failing("one"), Validators.valid())).validate(VALUE);
        assertThat(result.valid()).isTrue();
    }

    @Test
    void oneOfDistinguishesNoMatchFromManyMatches() {
        var none = Validators.oneOf(List.of(failing("one"), failing("two"))).validate(VALUE);
        var many = Validators.oneOf(List.of(Validators.valid(), Validators.valid())).validate(VALUE);

        assertThat(none.valid()).isFalse();
        assertThat(none.errors()).containsExactly(OneOfValidator.NO_MATCH, "one", "two");

        assertThat(many.valid()).isFalse();
        assertThat(many.errors()).containsExactly("Value matches more than one schema in 'oneOf' (2 matched)");
        assertThat(many.errors()).doesNotContainAnyElementsOf(none.errors());
    }

    @Test
    void notInvertsAndDropsInnerMessages() {
        var rejected = Validators.not(Validators.valid()).validate(VALUE);
        var accepted = Validators.not(failing("inner")).validate(VALUE);

        assertThat(rejected.valid()).isFalse();
        assertThat(rejected.errors()).containsExactly(NotValidator.MATCHED);
        assertThat(accepted.valid()).isTrue();
    }

    @Test
    void notMessageDoesNotDependOnInnerValidator() {
        var first = Validators.not(Validators.valid()).validate(VALUE);
        var second = Validators.not(Validators.allOf(Validators.valid(), Validators.valid())).validate(VALUE);
        assertThat(first).isEqualTo(second);
    }

    @Test
    void lambdasComposeWithCombinators() {
        Validator even = value -> value.isInt() && value.intValue() % 2 == 0
            ? ValidationResult.success()
            : ValidationResult.failure("odd");

        assertThat(Validators.allOf(even, Validators.valid()).validate(VALUE).valid()).isTrue();
        assertThat(Validators.allOf(even).validate(json("7")).errors()).containsExactly("odd");
    }
}
