package json.ecma.value;

import java.util.Objects;

/// A string primitive: a sequence of UTF-16 code units, not necessarily
/// well-formed (lone surrogates are allowed).
///
/// @param value the code units. Non-null.
public record JsString(String value) implements JsValue {

    private static final JsString EMPTY = new JsString("");

    public JsString {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static JsString of(String value) {
        return value.isEmpty() ? EMPTY : new JsString(value);
    }

    @Override
    public JsType typeKind() {
        return JsType.STRING;
    }

    @Override
    public String toString() {
        return value;
    }
}
