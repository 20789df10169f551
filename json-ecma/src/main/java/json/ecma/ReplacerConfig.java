package json.ecma;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import json.ecma.value.JsArray;
import json.ecma.value.JsConversions;
import json.ecma.value.JsObject;
import json.ecma.value.JsString;
import json.ecma.value.JsValue;

/// The resolved `replacer` argument of a `stringify` call.
sealed interface ReplacerConfig {

    /// No replacer: every own enumerable property is serialized.
    record None() implements ReplacerConfig {}

    /// An allow-list of property names, in output order, without duplicates.
    record KeyList(List<String> keys) implements ReplacerConfig {
        public KeyList {
            keys = List.copyOf(keys);
        }
    }

    /// A function called as `replacer.call(holder, key, value)` for every value.
    record ReplacerFunction(JsObject function) implements ReplacerConfig {
        public ReplacerFunction {
            Objects.requireNonNull(function);
        }
    }

    ReplacerConfig NONE = new None();

    /// Resolves the raw `replacer` argument.
    ///
    /// Callables win over arrays. For an array the elements `0 .. length-1`
    /// are read in order and numbers, strings and their boxed forms are kept
    /// as property names; anything else is ignored. Only getters and
    /// conversion callbacks the elements run can throw.
    static ReplacerConfig resolve(JsValue replacer) {
        if (replacer.isCallable()) {
            return new ReplacerFunction((JsObject) replacer);
        }
        if (!replacer.isArray()) {
            return NONE;
        }
        final JsObject array = (JsObject) replacer;
        final long length = array instanceof JsArray nativeArray
                ? nativeArray.length()
                : JsConversions.toUint32(array.getProperty("length"));
        final List<String> names = new ArrayList<>();
        for (long i = 0; i < length; i++) {
            final String name = propertyName(array.getProperty(i));
            if (name != null) {
                names.add(name);
            }
        }
        final LinkedHashSet<String> unique = new LinkedHashSet<>(names);
        if (unique.size() > names.size()) {
            throw new InternalError("Compacted key list is longer than its source");
        }
        Logger.getLogger(ReplacerConfig.class.getName())
                .fine(() -> "Replacer key list resolved: " + unique.size() + " of " + length + " elements kept");
        return new KeyList(new ArrayList<>(unique));
    }

    /// {@return the property name an element of a replacer array denotes, or `null` to skip it}
    private static String propertyName(JsValue element) {
        return switch (element.typeKind()) {
            case STRING -> ((JsString) element).value();
            case NUMBER -> element.toString();
            case NUMBER_OBJECT, STRING_OBJECT -> JsConversions.toString(element);
            default -> null;
        };
    }
}
