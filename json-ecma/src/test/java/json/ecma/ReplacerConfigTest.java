package json.ecma;

import json.ecma.value.AbstractJsObject;
import json.ecma.value.JsArray;
import json.ecma.value.JsBoolean;
import json.ecma.value.JsFunction;
import json.ecma.value.JsNull;
import json.ecma.value.JsNumber;
import json.ecma.value.JsPlainObject;
import json.ecma.value.JsPrimitiveWrapper;
import json.ecma.value.JsSymbol;
import json.ecma.value.JsValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReplacerConfigTest extends EcmaJsonTestBase {

    private static List<String> keys(JsValue replacer) {
        final ReplacerConfig config = ReplacerConfig.resolve(replacer);
        assertThat(config).isInstanceOf(ReplacerConfig.KeyList.class);
        return ((ReplacerConfig.KeyList) config).keys();
    }

    @Test
    void testNonArrayNonCallableMeansNone() {
        assertThat(ReplacerConfig.resolve(UNDEFINED)).isSameAs(ReplacerConfig.NONE);
        assertThat(ReplacerConfig.resolve(JsNull.of())).isSameAs(ReplacerConfig.NONE);
        assertThat(ReplacerConfig.resolve(str("a"))).isSameAs(ReplacerConfig.NONE);
        assertThat(ReplacerConfig.resolve(new JsPlainObject().put("0", str("a")))).isSameAs(ReplacerConfig.NONE);
    }

    @Test
    void testCallableWins() {
        final JsFunction fn = JsFunction.of((self, args) -> JsFunction.argument(args, 1));
        fn.put("length", num(1)).put("0", str("a"));

        assertThat(ReplacerConfig.resolve(fn)).isEqualTo(new ReplacerConfig.ReplacerFunction(fn));
    }

    @Test
    void testKeyListAcceptsNumbersAndStringsOnly() {
        final JsArray replacer = JsArray.of(
                str("b"), num(1), JsNumber.of(1.5), JsBoolean.TRUE, JsNull.of(), UNDEFINED,
                JsSymbol.of("s"), new JsPlainObject(), JsPrimitiveWrapper.ofNumber(2),
                JsPrimitiveWrapper.ofString("w"), JsPrimitiveWrapper.ofBoolean(true));

        assertThat(keys(replacer)).containsExactly("b", "1", "1.5", "2", "w");
    }

    @Test
    void testKeyListHoldsAnUnmodifiableCopy() {
        final List<String> source = new ArrayList<>(List.of("a", "b"));
        final ReplacerConfig.KeyList list = new ReplacerConfig.KeyList(source);
        source.add("c");

        assertThat(list.keys()).containsExactly("a", "b");
        assertThat(new ReplacerConfig.ReplacerFunction(JsFunction.of((self, args) -> UNDEFINED)).function().isCallable())
                .isTrue();
    }

    @Test
    void testKeyListDeduplicatesKeepingFirst() {
        final JsArray replacer = JsArray.of(str("b"), str("a"), str("b"), num(1), str("1"));

        assertThat(keys(replacer)).containsExactly("b", "a", "1");
    }

    @Test
    void testHolesAreSkipped() {
        final JsArray replacer = JsArray.of(str("a"));
        replacer.set(2, str("c"));

        assertThat(keys(replacer)).containsExactly("a", "c");
    }

    @Test
    void testHostArrayLikeUsesUint32Length() {
        final List<String> reads = new ArrayList<>();
        final JsValue arrayLike = new AbstractJsObject() {
            @Override
            public boolean isArray() {
                return true;
            }

            @Override
            public JsValue getProperty(String key) {
                reads.add(key);
                return switch (key) {
                    case "length" -> num(-4294967294.0);
                    case "0" -> str("x");
                    case "1" -> num(7);
                    default -> UNDEFINED;
                };
            }
        };

        assertThat(keys(arrayLike)).containsExactly("x", "7");
        assertThat(reads).containsExactly("length", "0", "1");
    }

    @Test
    void testKeyListSelectsAndOrdersMembersAtEveryLevel() {
        final JsPlainObject proto = new JsPlainObject().put("inherited", num(0));
        final JsPlainObject obj = new JsPlainObject(proto)
                .put("a", num(1))
                .put("b", new JsPlainObject().put("a", num(2)).put("z", num(3)))
                .put("c", num(4));

        final JsArray replacer = JsArray.of(str("b"), str("inherited"), str("a"), str("missing"));

        assertThat(stringify(obj, replacer, UNDEFINED)).isEqualTo("{\"b\":{\"a\":2},\"inherited\":0,\"a\":1}");
    }

    @Test
    void testKeyListDoesNotFilterArrayElements() {
        final JsPlainObject obj = new JsPlainObject()
                .put("list", JsArray.of(new JsPlainObject().put("list", num(1)).put("x", num(2)), num(3)));

        assertThat(stringify(obj, JsArray.of(str("list")), UNDEFINED)).isEqualTo("{\"list\":[{\"list\":1},3]}");
    }

    @Test
    void testReplacerFunctionSuppressesAndRewrites() {
        final JsPlainObject obj = new JsPlainObject()
                .put("name", str("n"))
                .put("secret", str("s"))
                .put("count", num(2))
                .put("nested", JsArray.of(num(5)));
        final JsFunction replacer = JsFunction.of((self, args) -> {
            final String key = JsFunction.argument(args, 0).toString();
            final JsValue value = JsFunction.argument(args, 1);
            if (key.equals("secret")) {
                return UNDEFINED;
            }
            if (value instanceof JsNumber n) {
                return str("#" + n.toString());
            }
            return value;
        });

        assertThat(stringify(obj, replacer, UNDEFINED))
                .isEqualTo("{\"name\":\"n\",\"count\":\"#2\",\"nested\":[\"#5\"]}");
    }

    @Test
    void testReplacerFunctionSeesHolderAndRootKey() {
        final List<String> calls = new ArrayList<>();
        final JsPlainObject obj = new JsPlainObject().put("k", num(1));
        final JsFunction replacer = JsFunction.of((self, args) -> {
            final JsPlainObject holder = (JsPlainObject) self;
            final String key = JsFunction.argument(args, 0).toString();
            calls.add(key + "=" + (holder.getProperty(key) == JsFunction.argument(args, 1)));
            return JsFunction.argument(args, 1);
        });

        assertThat(stringify(obj, replacer, UNDEFINED)).isEqualTo("{\"k\":1}");
        assertThat(calls).containsExactly("=true", "k=true");
    }

    @Test
    void testReplacerFunctionCanSuppressTheRoot() {
        final JsFunction replacer = JsFunction.of((self, args) -> UNDEFINED);

        assertThat(JSON.stringify(num(1), replacer, UNDEFINED)).isEmpty();
    }
}
