package json.ecma;

import json.ecma.value.AbstractJsObject;
import json.ecma.value.JsArray;
import json.ecma.value.JsBoolean;
import json.ecma.value.JsErrorType;
import json.ecma.value.JsException;
import json.ecma.value.JsFunction;
import json.ecma.value.JsNull;
import json.ecma.value.JsNumber;
import json.ecma.value.JsPlainObject;
import json.ecma.value.JsPrimitiveWrapper;
import json.ecma.value.JsSymbol;
import json.ecma.value.JsValue;
import json.ecma.value.JsValues;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringifyTest extends EcmaJsonTestBase {

    @Test
    void testPrimitives() {
        assertThat(stringify(JsNull.of())).isEqualTo("null");
        assertThat(stringify(JsBoolean.TRUE)).isEqualTo("true");
        assertThat(stringify(JsBoolean.FALSE)).isEqualTo("false");
        assertThat(stringify(num(1.5))).isEqualTo("1.5");
        assertThat(stringify(num(-0.0))).isEqualTo("0");
        assertThat(stringify(num(1e21))).isEqualTo("1e+21");
        assertThat(stringify(str("hi"))).isEqualTo("\"hi\"");
    }

    @Test
    void testNonFiniteNumbersBecomeNull() {
        assertThat(stringify(num(Double.NaN))).isEqualTo("null");
        assertThat(stringify(num(Double.POSITIVE_INFINITY))).isEqualTo("null");
        assertThat(stringify(array(Double.NEGATIVE_INFINITY, 1))).isEqualTo("[null,1]");
    }

    @Test
    void testExactIntegerVariants() {
        assertThat(stringify(JsNumber.ofInt64(Long.MAX_VALUE))).isEqualTo("9223372036854775807");
        assertThat(stringify(JsNumber.ofUint64(-1L))).isEqualTo("18446744073709551615");
    }

    @Test
    void testUnserializableRootGivesEmpty() {
        assertThat(JSON.stringify(UNDEFINED)).isEmpty();
        assertThat(JSON.stringify(JsSymbol.of("s"))).isEmpty();
        assertThat(JSON.stringify(JsFunction.of((self, args) -> UNDEFINED))).isEmpty();
        assertThat(JSON.stringifyValue(UNDEFINED, UNDEFINED, UNDEFINED)).isSameAs(UNDEFINED);
        assertThat(JSON.stringifyValue(num(1), UNDEFINED, UNDEFINED)).isEqualTo(str("1"));
    }

    @Test
    void testNestedStructure() {
        final Map<String, Object> src = new LinkedHashMap<>();
        src.put("a", 1);
        src.put("b", List.of(true, "x"));
        src.put("c", Map.of());

        assertThat(stringify(JsValues.fromJava(src))).isEqualTo("{\"a\":1,\"b\":[true,\"x\"],\"c\":{}}");
    }

    @Test
    void testUnserializableMembersAreOmittedAndElementsBecomeNull() {
        final JsPlainObject obj = new JsPlainObject()
                .put("u", UNDEFINED)
                .put("f", JsFunction.of((self, args) -> UNDEFINED))
                .put("s", JsSymbol.of("s"))
                .put("d", num(1));
        final JsArray arr = JsArray.of(UNDEFINED, JsFunction.of((self, args) -> UNDEFINED), JsSymbol.of("s"));

        assertThat(stringify(obj)).isEqualTo("{\"d\":1}");
        assertThat(stringify(arr)).isEqualTo("[null,null,null]");
        assertThat(stringify(new JsPlainObject().put("only", UNDEFINED))).isEqualTo("{}");
    }

    @Test
    void testHolesBecomeNull() {
        final JsArray arr = JsArray.of(num(1));
        arr.set(2, num(3));

        assertThat(stringify(arr)).isEqualTo("[1,null,3]");
    }

    @Test
    void testIntegerKeysFirst() {
        final JsPlainObject obj = new JsPlainObject()
                .put("b", num(1))
                .put("2", num(2))
                .put("a", num(3))
                .put("1", num(4));

        assertThat(stringify(obj)).isEqualTo("{\"1\":4,\"2\":2,\"b\":1,\"a\":3}");
    }

    @Test
    void testNumericIndentation() {
        final JsPlainObject obj = new JsPlainObject()
                .put("a", array(1, 2))
                .put("b", new JsPlainObject())
                .put("c", new JsArray());

        assertThat(stringify(obj, UNDEFINED, num(2))).isEqualTo(
                "{\n" +
                "  \"a\": [\n" +
                "    1,\n" +
                "    2\n" +
                "  ],\n" +
                "  \"b\": {},\n" +
                "  \"c\": []\n" +
                "}");
    }

    @Test
    void testStringIndentationIsTruncatedAtTen() {
        final JsPlainObject obj = new JsPlainObject().put("k", array(1));

        assertThat(stringify(obj, UNDEFINED, str("--"))).isEqualTo("{\n--\"k\": [\n----1\n--]\n}");
        assertThat(stringify(array(1), UNDEFINED, str("abcdefghijkl"))).isEqualTo("[\nabcdefghij1\n]");
    }

    @Test
    void testIndentationArgumentVariants() {
        final JsArray arr = array(1);

        assertThat(stringify(arr, UNDEFINED, num(20))).isEqualTo("[\n          1\n]");
        assertThat(stringify(arr, UNDEFINED, num(-3))).isEqualTo("[1]");
        assertThat(stringify(arr, UNDEFINED, num(2.9))).isEqualTo("[\n  1\n]");
        assertThat(stringify(arr, UNDEFINED, num(Double.POSITIVE_INFINITY))).isEqualTo("[1]");
        assertThat(stringify(arr, UNDEFINED, JsBoolean.TRUE)).isEqualTo("[1]");
        assertThat(stringify(arr, UNDEFINED, str(""))).isEqualTo("[1]");
        assertThat(stringify(arr, UNDEFINED, JsPrimitiveWrapper.ofNumber(3))).isEqualTo("[\n   1\n]");
        assertThat(stringify(arr, UNDEFINED, JsPrimitiveWrapper.ofString("\t"))).isEqualTo("[\n\t1\n]");
    }

    @Test
    void testToJsonIsCalledWithKey() {
        final List<String> keys = new ArrayList<>();
        final JsPlainObject date = new JsPlainObject().put("toJSON", JsFunction.of((self, args) -> {
            keys.add(JsFunction.argument(args, 0).toString());
            return str("2020-01-01");
        }));
        final JsPlainObject obj = new JsPlainObject().put("when", date).put("list", JsArray.of(date));

        assertThat(stringify(obj)).isEqualTo("{\"when\":\"2020-01-01\",\"list\":[\"2020-01-01\"]}");
        assertThat(keys).containsExactly("when", "0");
    }

    @Test
    void testToJsonOnPrototypeAndThis() {
        final JsPlainObject proto = new JsPlainObject().put("toJSON", JsFunction.of((self, args) ->
                ((JsPlainObject) self).getProperty("id")));
        final JsPlainObject obj = new JsPlainObject(proto).put("id", num(7)).put("ignored", num(8));

        assertThat(stringify(obj)).isEqualTo("7");
    }

    @Test
    void testToJsonRunsBeforeReplacer() {
        final List<String> seen = new ArrayList<>();
        final JsPlainObject value = new JsPlainObject()
                .put("toJSON", JsFunction.of((self, args) -> str("from toJSON")));
        final JsFunction replacer = JsFunction.of((self, args) -> {
            final JsValue v = JsFunction.argument(args, 1);
            seen.add(v.typeKind() + ":" + (v.isObject() ? "object" : v.toString()));
            return v;
        });

        assertThat(stringify(new JsPlainObject().put("v", value), replacer, UNDEFINED))
                .isEqualTo("{\"v\":\"from toJSON\"}");
        assertThat(seen).containsExactly("OBJECT:object", "STRING:from toJSON");
    }

    @Test
    void testBoxedValuesAreUnboxed() {
        final JsPlainObject obj = new JsPlainObject()
                .put("n", JsPrimitiveWrapper.ofNumber(5))
                .put("s", JsPrimitiveWrapper.ofString("s"))
                .put("b", JsPrimitiveWrapper.ofBoolean(false))
                .put("inf", JsPrimitiveWrapper.ofNumber(Double.POSITIVE_INFINITY));

        assertThat(stringify(obj)).isEqualTo("{\"n\":5,\"s\":\"s\",\"b\":false,\"inf\":null}");
    }

    @Test
    void testBoxedValuesUseOverriddenConversions() {
        final JsPrimitiveWrapper number = JsPrimitiveWrapper.ofNumber(1);
        number.put("valueOf", JsFunction.of((self, args) -> num(42)));
        final JsPrimitiveWrapper string = JsPrimitiveWrapper.ofString("a");
        string.defineHidden("toString", JsFunction.of((self, args) -> str("b")));

        assertThat(stringify(number)).isEqualTo("42");
        assertThat(stringify(string)).isEqualTo("\"b\"");
    }

    @Test
    void testAccessorsAreRead() {
        final JsPlainObject obj = new JsPlainObject()
                .defineAccessor("computed", JsFunction.of((self, args) -> num(3)), null);

        assertThat(stringify(obj)).isEqualTo("{\"computed\":3}");
    }

    @Test
    void testEscaping() {
        assertThat(stringify(str("\"\\\b\f\n\r\t\u0001\u001f")))
                .isEqualTo("\"\\\"\\\\\\b\\f\\n\\r\\t\\u0001\\u001f\"");
        assertThat(stringify(str("\ud800"))).isEqualTo("\"\\ud800\"");
        assertThat(stringify(str("\udc00x"))).isEqualTo("\"\\udc00x\"");
        assertThat(stringify(str("\ud83d\ude00"))).isEqualTo("\"\ud83d\ude00\"");
        assertThat(stringify(str("\u2028/"))).isEqualTo("\"\u2028/\"");
        assertThat(stringify(new JsPlainObject().put("k\"ey", num(1)))).isEqualTo("{\"k\\\"ey\":1}");
    }

    @Test
    void testHostObjects() {
        final JsValue host = new AbstractJsObject() {
            @Override
            public List<String> getOwnEnumerableKeys() {
                return List.of("x", "y");
            }

            @Override
            public JsValue getProperty(String key) {
                return key.equals("x") || key.equals("y") ? str(key.toUpperCase()) : UNDEFINED;
            }
        };

        assertThat(stringify(host)).isEqualTo("{\"x\":\"X\",\"y\":\"Y\"}");
    }

    @Test
    void testHostArrayLike() {
        final JsValue arrayLike = new AbstractJsObject() {
            @Override
            public boolean isArray() {
                return true;
            }

            @Override
            public JsValue getProperty(String key) {
                return switch (key) {
                    case "length" -> str("2");
                    case "0" -> num(10);
                    case "1" -> JsBoolean.TRUE;
                    default -> UNDEFINED;
                };
            }
        };

        assertThat(stringify(arrayLike)).isEqualTo("[10,true]");
    }

    @Test
    void testHugeArrayLikeIsARangeErrorBeforeAnyElementIsRead() {
        final List<String> reads = new ArrayList<>();
        final JsValue arrayLike = new AbstractJsObject() {
            @Override
            public boolean isArray() {
                return true;
            }

            @Override
            public JsValue getProperty(String key) {
                reads.add(key);
                return key.equals("length") ? num(4294967296.0) : UNDEFINED;
            }
        };

        assertThatThrownBy(() -> JSON.stringify(arrayLike))
                .isInstanceOf(JsException.class)
                .hasMessage("Array length 4294967296 exceeds the maximum string length 2147483639")
                .satisfies(e -> assertThat(((JsException) e).type()).isEqualTo(JsErrorType.RANGE_ERROR));
        assertThat(reads).containsExactly("toJSON", "length");
    }

    @Test
    void testOutputLengthLimit() {
        final EcmaJson limited = EcmaJson.withOptions(JsonOptions.defaults().withMaxStringLength(10));

        assertThat(limited.stringify(str("abcdefgh"))).contains("\"abcdefgh\"");
        assertThatThrownBy(() -> limited.stringify(str("abcdefghi")))
                .isInstanceOf(JsException.class)
                .hasMessage("JSON output exceeds the maximum string length 10");
        assertThatThrownBy(() -> limited.stringify(array(1, 2, 3, 4, 5, 6, 7, 8, 9, 10)))
                .isInstanceOf(JsException.class)
                .hasMessage("Array length 10 exceeds the maximum string length 10");
    }

    private static JsValue undefinedElements(long length, List<String> reads) {
        return new AbstractJsObject() {
            @Override
            public boolean isArray() {
                return true;
            }

            @Override
            public JsValue getProperty(String key) {
                reads.add(key);
                return key.equals("length") ? num(length) : UNDEFINED;
            }
        };
    }

    @Test
    void testArrayTooLongForItsShortestOutputIsRejectedUpFront() {
        final List<String> reads = new ArrayList<>();
        final EcmaJson limited = EcmaJson.withOptions(JsonOptions.defaults().withMaxStringLength(100));

        assertThatThrownBy(() -> limited.stringify(undefinedElements(60, reads)))
                .isInstanceOf(JsException.class)
                .hasMessage("JSON output exceeds the maximum string length 100");
        assertThat(reads).containsExactly("toJSON", "length");
    }

    @Test
    void testHugeArrayLikeOfUndefinedIsARangeErrorNotAnOutOfMemoryError() {
        final List<String> reads = new ArrayList<>();

        assertThatThrownBy(() -> JSON.stringify(undefinedElements(1_500_000_000L, reads)))
                .isInstanceOf(JsException.class)
                .hasMessage("JSON output exceeds the maximum string length 2147483639")
                .satisfies(e -> assertThat(((JsException) e).type()).isEqualTo(JsErrorType.RANGE_ERROR));
        assertThat(reads).containsExactly("toJSON", "length");
    }

    @Test
    void testNullPlaceholdersCountTowardsTheOutputLimit() {
        final List<String> reads = new ArrayList<>();
        final EcmaJson limited = EcmaJson.withOptions(JsonOptions.defaults().withMaxStringLength(20));

        assertThatThrownBy(() -> limited.stringify(undefinedElements(9, reads)))
                .isInstanceOf(JsException.class)
                .hasMessage("JSON output exceeds the maximum string length 20");
        assertThat(reads).contains("4").doesNotContain("5");
    }

    @Test
    void testCallbackExceptionsPropagateUnchanged() {
        final IllegalStateException boom = new IllegalStateException("boom");
        final JsPlainObject obj = new JsPlainObject()
                .put("toJSON", JsFunction.of((self, args) -> {
                    throw boom;
                }));

        assertThatThrownBy(() -> JSON.stringify(obj)).isSameAs(boom);
    }
}
