package json.ecma.value;

import java.math.BigInteger;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.regex.Pattern;

/// The abstract type conversions of ECMA-262 section 7.1 that the JSON
/// algorithms rely on.
public final class JsConversions {

    /// 2^53 - 1, the largest length `ToLength` produces.
    public static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

    /// 2^32 - 2, the largest array index.
    public static final long MAX_ARRAY_INDEX = 0xFFFF_FFFEL;

    private static final double TWO_TO_32 = 4294967296.0;

    private static final Pattern DECIMAL_LITERAL = Pattern.compile(
            "[+-]?(?:\\d+\\.?\\d*(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?)");

    private static final ThreadLocal<Set<Object>> JOINING =
            ThreadLocal.withInitial(() -> Collections.newSetFromMap(new IdentityHashMap<>()));

    /// The preferred type passed to {@link #toPrimitive(JsValue, Hint)}.
    public enum Hint { DEFAULT, NUMBER, STRING }

    private JsConversions() {}

    /// `ToPrimitive`: primitives are returned as is. Objects are asked for
    /// `valueOf` and `toString` (in hint order); if neither is defined the
    /// object's intrinsic primitive is used: the wrapped value of a
    /// {@link JsPrimitiveWrapper}, the comma-joined elements of an array,
    /// `"[object Object]"` for anything else.
    ///
    /// @throws JsException a `TypeError` if the methods exist but none returns a primitive
    public static JsValue toPrimitive(JsValue value, Hint hint) {
        if (!value.isObject()) {
            return value;
        }
        JsObject obj = (JsObject) value;
        String first = hint == Hint.STRING ? "toString" : "valueOf";
        String second = hint == Hint.STRING ? "valueOf" : "toString";
        boolean sawMethod = false;
        for (String name : new String[]{first, second}) {
            JsValue method = obj.getProperty(name);
            if (method.isCallable()) {
                sawMethod = true;
                JsValue result = ((JsObject) method).invoke(obj);
                if (!result.isObject()) {
                    return result;
                }
            }
        }
        if (sawMethod) {
            throw JsException.typeError("Cannot convert object to primitive value");
        }
        return intrinsicPrimitive(obj);
    }

    private static JsValue intrinsicPrimitive(JsObject obj) {
        if (obj instanceof JsPrimitiveWrapper wrapper) {
            return wrapper.primitive();
        }
        if (obj.isCallable()) {
            return JsString.of(obj.toString());
        }
        if (obj.isArray()) {
            return JsString.of(join(obj));
        }
        return JsString.of("[object Object]");
    }

    /// Joins the elements with commas. An array that is already being joined
    /// further up the stack contributes the empty string.
    private static String join(JsObject array) {
        final Set<Object> joining = JOINING.get();
        final Object id = array.identity();
        if (!joining.add(id)) {
            return "";
        }
        try {
            long length = array.arrayLength();
            StringBuilder sb = new StringBuilder();
            for (long i = 0; i < length; i++) {
                if (i > 0) {
                    sb.append(',');
                }
                JsValue element = array.getProperty(i);
                if (element.typeKind() != JsType.UNDEFINED && element.typeKind() != JsType.NULL) {
                    sb.append(toString(element));
                }
            }
            return sb.toString();
        } finally {
            joining.remove(id);
        }
    }

    /// `ToString`.
    ///
    /// @throws JsException a `TypeError` for symbols
    public static String toString(JsValue value) {
        return switch (value.typeKind()) {
            case UNDEFINED -> "undefined";
            case NULL -> "null";
            case BOOLEAN -> ((JsBoolean) value).value() ? "true" : "false";
            case NUMBER -> value.toString();
            case STRING -> ((JsString) value).value();
            case SYMBOL -> throw JsException.typeError("Cannot convert a Symbol value to a string");
            default -> toString(toPrimitive(value, Hint.STRING));
        };
    }

    /// `ToNumber`.
    ///
    /// @throws JsException a `TypeError` for symbols
    public static double toNumber(JsValue value) {
        return switch (value.typeKind()) {
            case UNDEFINED -> Double.NaN;
            case NULL -> 0.0;
            case BOOLEAN -> ((JsBoolean) value).value() ? 1.0 : 0.0;
            case NUMBER -> ((JsNumber) value).value();
            case STRING -> stringToNumber(((JsString) value).value());
            case SYMBOL -> throw JsException.typeError("Cannot convert a Symbol value to a number");
            default -> toNumber(toPrimitive(value, Hint.NUMBER));
        };
    }

    /// `ToIntegerOrInfinity`: NaN becomes 0, infinities are kept, everything
    /// else is truncated toward zero.
    public static double toIntegerOrInfinity(JsValue value) {
        return toIntegerOrInfinity(toNumber(value));
    }

    public static double toIntegerOrInfinity(double d) {
        if (Double.isNaN(d)) {
            return 0.0;
        }
        if (Double.isInfinite(d)) {
            return d;
        }
        // + 0.0 turns -0 into +0
        return (d < 0 ? Math.ceil(d) : Math.floor(d)) + 0.0;
    }

    /// `ToLength`: an integer clamped to `[0, 2^53 - 1]`.
    public static long toLength(JsValue value) {
        double len = toIntegerOrInfinity(value);
        if (len <= 0) {
            return 0L;
        }
        return len >= MAX_SAFE_INTEGER ? MAX_SAFE_INTEGER : (long) len;
    }

    /// `ToUint32`.
    public static long toUint32(JsValue value) {
        double d = toNumber(value);
        if (!Double.isFinite(d)) {
            return 0L;
        }
        double t = (d < 0 ? Math.ceil(d) : Math.floor(d)) % TWO_TO_32;
        long l = (long) t;
        return l < 0 ? l + (1L << 32) : l;
    }

    /// {@return the array index `key` denotes, or -1 if it is not a canonical array index}
    public static long arrayIndex(String key) {
        int len = key.length();
        if (len == 0 || len > 10) {
            return -1L;
        }
        char first = key.charAt(0);
        if (first == '0') {
            return len == 1 ? 0L : -1L;
        }
        long index = 0;
        for (int i = 0; i < len; i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') {
                return -1L;
            }
            index = index * 10 + (c - '0');
        }
        return index <= MAX_ARRAY_INDEX ? index : -1L;
    }

    /// `StringToNumber`: the `StringNumericLiteral` grammar, including the
    /// `0x`/`0o`/`0b` prefixes and `Infinity`. Anything else is NaN.
    static double stringToNumber(String str) {
        String s = trim(str);
        if (s.isEmpty()) {
            return 0.0;
        }
        if (s.length() > 2 && s.charAt(0) == '0') {
            int radix = switch (s.charAt(1)) {
                case 'x', 'X' -> 16;
                case 'o', 'O' -> 8;
                case 'b', 'B' -> 2;
                default -> 0;
            };
            if (radix != 0) {
                String digits = s.substring(2);
                for (int i = 0; i < digits.length(); i++) {
                    if (Character.digit(digits.charAt(i), radix) < 0) {
                        return Double.NaN;
                    }
                }
                return new BigInteger(digits, radix).doubleValue();
            }
        }
        switch (s) {
            case "Infinity", "+Infinity" -> {
                return Double.POSITIVE_INFINITY;
            }
            case "-Infinity" -> {
                return Double.NEGATIVE_INFINITY;
            }
            default -> {
                // fall through to the decimal grammar
            }
        }
        if (!DECIMAL_LITERAL.matcher(s).matches()) {
            return Double.NaN;
        }
        return Double.parseDouble(s);
    }

    private static String trim(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isWhitespace(s.charAt(start))) {
            start++;
        }
        while (end > start && isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end);
    }

    /// WhiteSpace and LineTerminator code points.
    static boolean isWhitespace(char c) {
        return switch (c) {
            case 0x09, 0x0A, 0x0B, 0x0C, 0x0D, 0x20, 0xA0, 0x1680,
                 0x2028, 0x2029, 0x202F, 0x205F, 0x3000, 0xFEFF -> true;
            default -> c >= 0x2000 && c <= 0x200A;
        };
    }
}
