package json.ecma;

import java.util.List;
import java.util.logging.Logger;

import json.ecma.value.JsBoolean;
import json.ecma.value.JsConversions;
import json.ecma.value.JsException;
import json.ecma.value.JsNumber;
import json.ecma.value.JsObject;
import json.ecma.value.JsPlainObject;
import json.ecma.value.JsPrimitiveWrapper;
import json.ecma.value.JsString;
import json.ecma.value.JsValue;

/// The state of one `stringify` call.
///
/// All output goes to a single buffer. A member whose value turns out not to
/// be serializable is rolled back by truncating the buffer to where the
/// member started. A session is used once and then discarded.
final class StringifySession {

    private static final Logger LOG = Logger.getLogger(StringifySession.class.getName());

    private final ReplacerConfig replacer;
    private final GapConfig gap;
    private final JsonOptions options;
    private final AncestorStack ancestors = new AncestorStack();
    private final StringBuilder out = new StringBuilder();

    private int indentDepth;

    StringifySession(ReplacerConfig replacer, GapConfig gap, JsonOptions options) {
        this.replacer = replacer;
        this.gap = gap;
        this.options = options;
    }

    /// Serializes `value` as the `""` member of a fresh wrapper object.
    ///
    /// @return the JSON text, or `null` if the root value is not serializable
    String run(JsValue value) {
        LOG.fine(() -> "Stringify session started: replacer=" + replacer.getClass().getSimpleName()
                + " gap=" + gap.unit().length());
        final JsPlainObject wrapper = new JsPlainObject();
        wrapper.put("", value);
        if (!str("", wrapper, value)) {
            LOG.finer("Root value is not serializable");
            return null;
        }
        if (ancestors.size() != 0) {
            throw new InternalError("Ancestor stack not empty after serialization: " + ancestors.size());
        }
        return out.toString();
    }

    /// `SerializeJSONProperty`: appends the serialized `value` of `holder[key]`.
    ///
    /// @return `false` if nothing was appended because the value is not serializable
    private boolean str(String key, JsObject holder, JsValue value) {
        if (value.isObject()) {
            final JsValue toJSON = ((JsObject) value).getProperty("toJSON");
            if (toJSON.isCallable()) {
                value = ((JsObject) toJSON).invoke(value, JsString.of(key));
            }
        }
        if (replacer instanceof ReplacerConfig.ReplacerFunction function) {
            value = function.function().invoke(holder, JsString.of(key), value);
        }
        value = unbox(value);

        if (value.isCallable()) {
            return false;
        }
        switch (value.typeKind()) {
            case UNDEFINED:
            case SYMBOL:
                return false;
            case NULL:
                out.append("null");
                break;
            case BOOLEAN:
                out.append(((JsBoolean) value).value() ? "true" : "false");
                break;
            case NUMBER: {
                final JsNumber number = (JsNumber) value;
                out.append(number.isFinite() ? number.toString() : "null");
                break;
            }
            case STRING:
                JsonQuoter.quote(((JsString) value).value(), out);
                break;
            default: {
                final JsObject obj = (JsObject) value;
                if (obj.isArray()) {
                    serializeArray(obj);
                } else {
                    serializeObject(obj);
                }
            }
        }
        checkOutputLength();
        return true;
    }

    private static JsValue unbox(JsValue value) {
        switch (value.typeKind()) {
            case NUMBER_OBJECT:
                return JsNumber.of(JsConversions.toNumber(value));
            case STRING_OBJECT:
                return JsString.of(JsConversions.toString(value));
            case BOOLEAN_OBJECT:
                return value instanceof JsPrimitiveWrapper wrapper
                        ? wrapper.primitive()
                        : JsConversions.toPrimitive(value, JsConversions.Hint.DEFAULT);
            default:
                return value;
        }
    }

    /// `SerializeJSONObject`.
    private void serializeObject(JsObject value) {
        try (AncestorStack.Scope ignored = enter(value)) {
            final int stepback = indentDepth;
            indentDepth++;
            try {
                final List<String> keys = replacer instanceof ReplacerConfig.KeyList list
                        ? list.keys()
                        : value.getOwnEnumerableKeys();
                out.append('{');
                boolean any = false;
                for (String key : keys) {
                    final int mark = out.length();
                    openMember(any);
                    JsonQuoter.quote(key, out);
                    out.append(gap.propertySeparator());
                    if (str(key, value, value.getProperty(key))) {
                        any = true;
                    } else {
                        out.setLength(mark);
                    }
                }
                closeContainer(any, stepback, '}');
            } finally {
                indentDepth = stepback;
            }
        }
    }

    /// `SerializeJSONArray`.
    private void serializeArray(JsObject value) {
        try (AncestorStack.Scope ignored = enter(value)) {
            final int stepback = indentDepth;
            indentDepth++;
            try {
                final long length = value.arrayLength();
                if (length >= options.maxStringLength()) {
                    throw JsException.rangeError("Array length %d exceeds the maximum string length %d"
                            .formatted(length, options.maxStringLength()));
                }
                // every element takes at least one character plus a separator
                if (out.length() + 2 * length + 1 > options.maxStringLength()) {
                    throw outputTooLong();
                }
                out.append('[');
                for (long i = 0; i < length; i++) {
                    openMember(i > 0);
                    if (!str(Long.toString(i), value, value.getProperty(i))) {
                        out.append("null");
                        checkOutputLength();
                    }
                }
                closeContainer(length > 0, stepback, ']');
            } finally {
                indentDepth = stepback;
            }
        }
    }

    private AncestorStack.Scope enter(JsObject value) {
        if (ancestors.contains(value)) {
            LOG.fine(() -> "Cycle detected at nesting depth " + ancestors.size());
        } else if (ancestors.size() >= options.maxDepth()) {
            throw JsException.rangeError("Maximum call stack size exceeded");
        }
        return ancestors.enter(value);
    }

    private void openMember(boolean notFirst) {
        if (notFirst) {
            out.append(gap.memberSeparator(indentDepth));
        } else if (!gap.isCompact()) {
            out.append('\n').append(gap.indent(indentDepth));
        }
    }

    private void closeContainer(boolean nonEmpty, int stepback, char close) {
        if (nonEmpty && !gap.isCompact()) {
            out.append('\n').append(gap.indent(stepback));
        }
        out.append(close);
    }

    private void checkOutputLength() {
        if (out.length() > options.maxStringLength()) {
            throw outputTooLong();
        }
    }

    private JsException outputTooLong() {
        return JsException.rangeError("JSON output exceeds the maximum string length %d"
                .formatted(options.maxStringLength()));
    }
}
