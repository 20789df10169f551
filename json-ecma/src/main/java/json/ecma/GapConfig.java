package json.ecma;

import java.util.logging.Logger;

import json.ecma.value.JsConversions;
import json.ecma.value.JsNumber;
import json.ecma.value.JsString;
import json.ecma.value.JsType;
import json.ecma.value.JsValue;

/// The indentation unit of a `stringify` call, resolved once from its
/// `space` argument.
///
/// An empty unit selects compact output. Separators and indent strings are
/// derived from the unit and cached per depth.
final class GapConfig {

    private static final Logger LOG = Logger.getLogger(GapConfig.class.getName());

    static final int MAX_GAP = 10;

    static final GapConfig COMPACT = new GapConfig("");

    private final String unit;
    private String[] indents = new String[0];

    private GapConfig(String unit) {
        this.unit = unit;
    }

    /// Resolves the `space` argument.
    ///
    /// A boxed Number is converted with `ToNumber` and a boxed String with
    /// `ToString`, either of which may run user code. A finite number gives
    /// that many spaces, clamped to `[0, 10]`; a string gives its first ten
    /// code units. Anything else, non-finite numbers included, is compact.
    static GapConfig resolve(JsValue space) {
        JsValue value = space;
        if (value.typeKind() == JsType.NUMBER_OBJECT) {
            value = JsNumber.of(JsConversions.toNumber(value));
        } else if (value.typeKind() == JsType.STRING_OBJECT) {
            value = JsString.of(JsConversions.toString(value));
        }
        final String unit;
        if (value.typeKind() == JsType.NUMBER) {
            final double d = ((JsNumber) value).value();
            if (Double.isFinite(d)) {
                final int n = (int) Math.max(0, Math.min(MAX_GAP, JsConversions.toIntegerOrInfinity(d)));
                unit = " ".repeat(n);
            } else {
                unit = "";
            }
        } else if (value.typeKind() == JsType.STRING) {
            final String s = ((JsString) value).value();
            unit = s.length() <= MAX_GAP ? s : s.substring(0, MAX_GAP);
        } else {
            unit = "";
        }
        LOG.finer(() -> "Resolved gap of length " + unit.length());
        return unit.isEmpty() ? COMPACT : new GapConfig(unit);
    }

    String unit() {
        return unit;
    }

    boolean isCompact() {
        return unit.isEmpty();
    }

    /// {@return the separator between a key and its value}
    String propertySeparator() {
        return isCompact() ? ":" : ": ";
    }

    /// {@return the indent for nesting `depth`: the unit repeated `depth` times}
    String indent(int depth) {
        if (depth <= 0 || isCompact()) {
            return "";
        }
        if (depth >= indents.length) {
            final String[] grown = new String[Math.max(depth + 1, indents.length * 2)];
            System.arraycopy(indents, 0, grown, 0, indents.length);
            indents = grown;
        }
        String s = indents[depth];
        if (s == null) {
            s = unit.repeat(depth);
            indents[depth] = s;
        }
        return s;
    }

    /// {@return the separator between members at nesting `depth`}
    String memberSeparator(int depth) {
        return isCompact() ? "," : ",\n" + indent(depth);
    }
}
