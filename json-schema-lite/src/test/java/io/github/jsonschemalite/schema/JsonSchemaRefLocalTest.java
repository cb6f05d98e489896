/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.jsonschemalite.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/// Local reference resolution: `#` and JSON Pointer fragments
class JsonSchemaRefLocalTest extends JsonSchemaTestBase {

    @Test
    void testDefinitionsByPointer() {
        var schema = schema("""
            {
              "definitions": {
                "posInt": { "type":"integer","minimum":1 }
              },
              "type":"array",
              "items": { "$ref":"#/definitions/posInt" }
            }
            """);

        assertThat(schema.validate(json("[1,2,3]")).valid()).isTrue();

        var result = schema.validate(json("[0]"));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Value is lower than minimum value of 1");
    }

    @Test
    void testNestedPointer() {
        /// A sibling property reuses another property's schema
        var schema = schema("""
            {
              "type":"object",
              "properties":{
                "user": {
                  "type":"object",
                  "properties":{
                    "id": { "type":"string","minLength":2 }
                  }
                },
                "refUser": { "$ref":"#/properties/user" }
              }
            }
            """);

        assertThat(schema.validate(json("{\"refUser\":{\"id\":\"aa\"}}")).valid()).isTrue();
        assertThat(schema.validate(json("{\"refUser\":{\"id\":\"a\"}}")).errors())
            .containsExactly("Length of string is smaller than minimum length 2");
    }

    @Test
    void testMissingSegmentIsNamed() {
        var schema = schema("""
            {"definitions": {"foo": {}}, "$ref": "#/definitions/bar"}
            """);

        var result = schema.validate(json("1"));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Reference not found 'bar' in '#/definitions/bar'");
    }

    @Test
    void testArrayIndexSegments() {
        var schema = schema("""
            {
              "definitions": { "list": [ {"type":"string"}, {"maxLength":3} ] },
              "properties": {
                "a": {"$ref":"#/definitions/list/1"},
                "b": {"$ref":"#/definitions/list/7"},
                "c": {"$ref":"#/definitions/list/01"}
              }
            }
            """);

        assertThat(schema.validate(json("{\"a\":\"abc\"}")).valid()).isTrue();
        assertThat(schema.validate(json("{\"a\":\"abcd\"}")).errors())
            .containsExactly("Length of string is larger than max length 3");
        assertThat(schema.validate(json("{\"b\":1,\"c\":2}")).errors()).containsExactly(
            "Reference not found '7' in '#/definitions/list/7'",
            "Reference not found '01' in '#/definitions/list/01'"
        );
    }

    @Test
    void testEscapedSegments() {
        var schema = schema("""
            {
              "definitions": {
                "a/b": {"type":"integer"},
                "m~n": {"type":"string"},
                "with space": {"type":"boolean"},
                "percent%": {"type":"null"}
              },
              "properties": {
                "slash": {"$ref":"#/definitions/a~1b"},
                "tilde": {"$ref":"#/definitions/m~0n"},
                "space": {"$ref":"#/definitions/with%20space"},
                "pct": {"$ref":"#/definitions/percent%25"}
              }
            }
            """);

        assertThat(schema.validate(json("""
            {"slash":1,"tilde":"x","space":true,"pct":null}
            """)).valid()).isTrue();
        assertThat(schema.validate(json("""
            {"slash":"1","tilde":1,"space":null,"pct":0}
            """)).errors()).containsExactly(
            "Expected type 'integer' but found string",
            "Expected type 'string' but found integer",
            "Expected type 'boolean' but found null",
            "Expected type 'null' but found integer"
        );
    }

    @Test
    void testRemoteReferencesAreUnsupported() {
        var schema = schema("""
            {
              "properties": {
                "a": {"$ref":"http://example.com/schema.json"},
                "b": {"$ref":"other.json#/definitions/x"},
                "c": {"$ref":"#foo"}
              }
            }
            """);

        assertThat(schema.validate(json("{}")).valid()).isTrue();
        assertThat(schema.validate(json("{\"a\":1,\"b\":2,\"c\":3}")).errors()).containsExactly(
            "Remote $ref 'http://example.com/schema.json' is not supported",
            "Remote $ref 'other.json#/definitions/x' is not supported",
            "Remote $ref '#foo' is not supported"
        );
    }

    @Test
    void testRootReferenceMatchesDirectValidation() {
        var direct = json("""
            {"type":"object","properties":{"n":{"type":"integer"}}}
            """);
        var viaRoot = json("""
            {
              "type":"object",
              "properties":{
                "n":{"type":"integer"},
                "child":{"$ref":"#"}
              }
            }
            """);

        for (String text : new String[]{"{\"n\":1}", "{\"n\":\"x\"}", "[]"}) {
            var value = json(text);
            assertThat(JsonSchema.validate(value, viaRoot)).isEqualTo(JsonSchema.validate(value, direct));
        }
    }

    @Test
    void testRecursiveTreeSchema() {
        var schema = schema("""
            {
              "definitions": {
                "node": {
                  "type":"object",
                  "required":["value"],
                  "properties":{
                    "value":{"type":"integer"},
                    "children":{"type":"array","items":{"$ref":"#/definitions/node"}}
                  }
                }
              },
              "$ref":"#/definitions/node"
            }
            """);

        assertThat(schema.validate(json("""
            {"value":1,"children":[{"value":2},{"value":3,"children":[{"value":4,"children":[]}]}]}
            """)).valid()).isTrue();

        assertThat(schema.validate(json("""
            {"value":1,"children":[{"value":2,"children":[{"value":"deep"}, {}]}]}
            """)).errors()).containsExactly(
            "Expected type 'integer' but found string",
            "Required property 'value' is missing"
        );
    }

    @Test
    void testSelfReferenceWithoutProgressIsACycle() {
        var schema = schema("""
            {"$ref":"#"}
            """);

        var result = schema.validate(json("1"));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Circular $ref '#' does not consume any input");
    }

    @Test
    void testMutualReferencesAreACycle() {
        var schema = schema("""
            {
              "definitions": {
                "a": {"$ref":"#/definitions/b"},
                "b": {"$ref":"#/definitions/a"}
              },
              "$ref":"#/definitions/a"
            }
            """);

        var result = schema.validate(json("{}"));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Circular $ref '#/definitions/a' does not consume any input");
    }

    @Test
    void testCycleThroughAnyOfStillFindsOtherBranch() {
        var schema = schema("""
            {"anyOf":[{"$ref":"#"},{"type":"integer"}]}
            """);

        assertThat(schema.validate(json("5")).valid()).isTrue();
        assertThat(schema.validate(json("\"x\"")).valid()).isFalse();
    }

    @Test
    void testRefDepthLimit() {
        var options = JsonSchemaOptions.DEFAULT.withMaxRefDepth(2);
        var schema = JsonSchema.parse("""
            {"type":"array","items":{"$ref":"#"}}
            """, options);

        assertThat(schema.validate(json("[[[]]]")).valid()).isTrue();

        var result = schema.validate(json("[[[[]]]]"));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Maximum $ref depth of 2 exceeded at '#'");
    }

    @Test
    void testRefKeepsSiblingKeywords() {
        var schema = schema("""
            {
              "definitions": {"str": {"type":"string"}},
              "$ref":"#/definitions/str",
              "maxLength": 2
            }
            """);

        assertThat(schema.validate(json("\"ab\"")).valid()).isTrue();
        assertThat(schema.validate(json("\"abc\"")).errors())
            .containsExactly("Length of string is larger than max length 2");
        assertThat(schema.validate(json("1")).errors())
            .containsExactly("Expected type 'string' but found integer");
    }
}
