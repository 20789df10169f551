package json.ecma.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Conversions between {@link JsValue} graphs and plain Java objects.
///
/// | Java object | JsValue |
/// |-------------|---------|
/// | `Map<String, ?>` | `JsPlainObject` |
/// | `List<?>` | `JsArray` |
/// | `Boolean` | `JsBoolean` |
/// | `null` | `JsNull` |
/// | `Number` | `JsNumber` |
/// | `String` | `JsString` |
///
/// ## Example
/// ```java
/// JsValue value = JsValues.fromJava(Map.of("scores", List.of(85, 90)));
/// Object back = JsValues.toJava(value); // {scores=[85, 90]}
/// ```
public final class JsValues {

    private static final int MAX_DEPTH = 1000;

    private JsValues() {}

    /// {@return a fresh value graph for the given Java object}
    ///
    /// `Long` and `BigInteger` values that fit a signed 64-bit integer are
    /// kept exact with {@link JsNumber#ofInt64(long)} unless they are safe
    /// integers. A `JsValue` is returned as is.
    ///
    /// @throws IllegalArgumentException if `src` cannot be converted
    public static JsValue fromJava(Object src) {
        if (src == null) {
            return JsNull.of();
        }
        if (src instanceof JsValue jv) {
            return jv;
        }
        if (src instanceof Map<?, ?> map) {
            JsPlainObject obj = new JsPlainObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                            "The key '%s' is not a String".formatted(entry.getKey()));
                }
                obj.put(key, fromJava(entry.getValue()));
            }
            return obj;
        }
        if (src instanceof List<?> list) {
            JsArray array = new JsArray();
            for (Object o : list) {
                array.add(fromJava(o));
            }
            return array;
        }
        if (src instanceof String str) {
            return JsString.of(str);
        }
        if (src instanceof Boolean bool) {
            return JsBoolean.of(bool);
        }
        if (src instanceof Long l) {
            return Math.abs(l) <= JsConversions.MAX_SAFE_INTEGER ? JsNumber.of(l) : JsNumber.ofInt64(l);
        }
        if (src instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? fromJava(bi.longValue()) : JsNumber.of(bi.doubleValue());
        }
        if (src instanceof BigDecimal bd) {
            return JsNumber.of(bd.doubleValue());
        }
        if (src instanceof Number n) {
            return JsNumber.of(n.doubleValue());
        }
        throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
    }

    /// {@return a Java object for the given value graph}
    ///
    /// Objects become `LinkedHashMap`s of their own enumerable properties, arrays
    /// become `ArrayList`s (holes and `undefined` become `null`), numbers that are
    /// integral and safe become `Long`, other numbers `Double`. Wrapper objects
    /// are unboxed the way `JSON.stringify` unboxes them.
    ///
    /// @throws IllegalArgumentException for symbols, functions, cyclic graphs
    ///         and graphs nested deeper than 1000 levels
    public static Object toJava(JsValue src) {
        Objects.requireNonNull(src);
        return toJava(src, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Object toJava(JsValue src, Set<Object> ancestors) {
        switch (src.typeKind()) {
            case UNDEFINED, NULL:
                return null;
            case BOOLEAN:
                return ((JsBoolean) src).value();
            case NUMBER: {
                double d = ((JsNumber) src).value();
                if (d == Math.rint(d) && Math.abs(d) <= JsConversions.MAX_SAFE_INTEGER) {
                    return (long) d;
                }
                return d;
            }
            case STRING:
                return ((JsString) src).value();
            case SYMBOL, FUNCTION:
                throw new IllegalArgumentException(src.typeKind() + " has no Java equivalent");
            case NUMBER_OBJECT:
                return toJava(JsNumber.of(JsConversions.toNumber(src)), ancestors);
            case STRING_OBJECT:
                return JsConversions.toString(src);
            case BOOLEAN_OBJECT:
                return toJava(src instanceof JsPrimitiveWrapper wrapper
                        ? wrapper.primitive()
                        : JsConversions.toPrimitive(src, JsConversions.Hint.DEFAULT), ancestors);
            default:
                return toJava((JsObject) src, ancestors);
        }
    }

    private static Object toJava(JsObject obj, Set<Object> ancestors) {
        final Object id = obj.identity();
        if (ancestors.contains(id)) {
            throw new IllegalArgumentException("value graph is cyclic");
        }
        if (ancestors.size() >= MAX_DEPTH) {
            throw new IllegalArgumentException("value graph is nested deeper than " + MAX_DEPTH);
        }
        ancestors.add(id);
        try {
            if (obj.isArray()) {
                long length = obj.arrayLength();
                List<Object> list = new ArrayList<>();
                for (long i = 0; i < length; i++) {
                    list.add(toJava(obj.getProperty(i), ancestors));
                }
                return list;
            }
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : obj.getOwnEnumerableKeys()) {
                map.put(key, toJava(obj.getProperty(key), ancestors));
            }
            return map;
        } finally {
            ancestors.remove(id);
        }
    }
}
